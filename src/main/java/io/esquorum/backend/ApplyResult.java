package io.esquorum.backend;

public record ApplyResult(
        boolean success,
        int value,
        String error
) {
    public static ApplyResult ok(int value) {
        return new ApplyResult(true, value, null);
    }

    public static ApplyResult fail(int value, String error) {
        return new ApplyResult(false, value, error);
    }
}
