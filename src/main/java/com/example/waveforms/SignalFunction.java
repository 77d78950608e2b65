package com.example.waveforms;

/**
 * A signal evaluated one sample at a time.
 *
 * @param <T> numeric value type
 */
@FunctionalInterface
public interface SignalFunction<T> {
    T evaluate(T t);
}
