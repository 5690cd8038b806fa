package kr.crownrpg.realtime.api.cache;

/**
 * Loads a value on cache miss. May block on network I/O.
 */
@FunctionalInterface
public interface Fetcher<T> {

    T fetch() throws Exception;
}
