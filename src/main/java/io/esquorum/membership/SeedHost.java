package io.esquorum.membership;

public record SeedHost(int ordinal, String host) {
}
