package io.esquorum.reconcile;

import java.io.IOException;

@FunctionalInterface
public interface Reconfigurer {
    void reconfigure(StructuralConfig config) throws IOException;
}
