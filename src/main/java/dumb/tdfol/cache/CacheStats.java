package dumb.tdfol.cache;

public record CacheStats(long totalRequests, long hits, long misses, int cacheSize, long evictions) {

    public double hitRate() {
        return totalRequests == 0 ? 0.0 : (double) hits / totalRequests;
    }
}
