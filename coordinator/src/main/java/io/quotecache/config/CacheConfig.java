package io.quotecache.config;

public record CacheConfig(
        String jdbcUrl,
        String jdbcUser,
        String jdbcPassword,
        String table,
        int refreshHourUtc,
        String sourcesResource
) {
    public static CacheConfig fromEnv() {
        String url = setting("quotecache.jdbc.url", "QUOTECACHE_JDBC_URL", "jdbc:h2:file:./quotecache-data/store;AUTO_SERVER=TRUE");
        String user = setting("quotecache.jdbc.user", "QUOTECACHE_JDBC_USER", null);
        String password = setting("quotecache.jdbc.password", "QUOTECACHE_JDBC_PASSWORD", null);
        String table = setting("quotecache.table", "QUOTECACHE_TABLE", "kv_store");
        int hour = Integer.parseInt(setting("quotecache.refresh.hour", "QUOTECACHE_REFRESH_HOUR", "6"));
        String sources = setting("quotecache.sources", "QUOTECACHE_SOURCES", "/quotecache-sources.properties");
        return new CacheConfig(url, user, password, table, Math.floorMod(hour, 24), sources);
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }
}
