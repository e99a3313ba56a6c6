package com.traneptora.lightlevel.util.functional;

import java.util.function.Supplier;

@FunctionalInterface
public interface ExceptionalSupplier<U> extends Supplier<U> {

    public U supplyExceptionally() throws Throwable;

    @Override
    public default U get() {
        try {
            return supplyExceptionally();
        } catch (Throwable ex) {
            return FunctionalHelper.sneakyThrow(ex);
        }
    }
}
