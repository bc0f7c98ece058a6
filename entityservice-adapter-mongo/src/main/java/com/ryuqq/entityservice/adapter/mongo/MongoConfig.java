package com.ryuqq.entityservice.adapter.mongo;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * MongoDB 연결 설정 (불변 record).
 *
 * <p><strong>설정 항목 (환경 변수):</strong></p>
 * <ul>
 *   <li>scheme: DB_TYPE (기본 mongodb, mongodb+srv 가능)</li>
 *   <li>host: DB_HOST (기본 localhost)</li>
 *   <li>port: DB_PORT (기본 27017, mongodb+srv에서는 무시)</li>
 *   <li>database: DB_NAME (기본 entityservice)</li>
 *   <li>username / password: DB_USER / DB_PASSWORD (둘 다 없으면 인증 없이 접속)</li>
 *   <li>serverSelectionTimeoutMs: 서버 선택 대기 시간 (기본 30000ms)</li>
 * </ul>
 *
 * <p>인증 정보가 있으면 admin 데이터베이스를 authSource로 사용합니다.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 * @param scheme 연결 문자열 스킴
 * @param host 호스트
 * @param port 포트 (1~65535)
 * @param database 데이터베이스 이름
 * @param username 사용자 (null 가능)
 * @param password 비밀번호 (null 가능)
 * @param serverSelectionTimeoutMs 서버 선택 대기 시간 (밀리초, 양수여야 함)
 */
public record MongoConfig(
    String scheme,
    String host,
    int port,
    String database,
    String username,
    String password,
    long serverSelectionTimeoutMs
) {

    static final String SRV_SCHEME = "mongodb+srv";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: mongodb://localhost:27017/entityservice, 인증 없음, serverSelectionTimeoutMs=30000ms</p>
     */
    public MongoConfig() {
        this("mongodb", "localhost", 27017, "entityservice", null, null, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MongoConfig {
        if (scheme == null || scheme.isBlank()) {
            throw new IllegalArgumentException("scheme cannot be null or blank");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535 (current: " + port + ")");
        }
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("database cannot be null or blank");
        }
        if ((username == null) != (password == null)) {
            throw new IllegalArgumentException("username and password must be set together");
        }
        if (serverSelectionTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "serverSelectionTimeoutMs must be positive (current: " + serverSelectionTimeoutMs + ")"
            );
        }
    }

    /**
     * 환경 변수 맵에서 설정을 읽습니다. 없는 키는 기본값을 씁니다.
     *
     * @param env 환경 변수 (보통 System.getenv())
     * @return 설정
     * @throws IllegalArgumentException DB_PORT가 숫자가 아니거나 검증 실패 시
     */
    public static MongoConfig fromEnvironment(Map<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        MongoConfig defaults = new MongoConfig();
        String port = env.get("DB_PORT");
        int parsedPort;
        try {
            parsedPort = port == null || port.isBlank() ? defaults.port() : Integer.parseInt(port.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("DB_PORT must be a number (current: " + port + ")", e);
        }
        return new MongoConfig(
            env.getOrDefault("DB_TYPE", defaults.scheme()),
            env.getOrDefault("DB_HOST", defaults.host()),
            parsedPort,
            env.getOrDefault("DB_NAME", defaults.database()),
            blankToNull(env.get("DB_USER")),
            blankToNull(env.get("DB_PASSWORD")),
            defaults.serverSelectionTimeoutMs()
        );
    }

    /**
     * 드라이버에 넘길 연결 문자열.
     *
     * <p>사용자와 비밀번호는 URL 인코딩됩니다.</p>
     */
    public String connectionString() {
        StringBuilder uri = new StringBuilder(scheme).append("://");
        if (hasCredentials()) {
            uri.append(encode(username)).append(':').append(encode(password)).append('@');
        }
        uri.append(host);
        if (!SRV_SCHEME.equals(scheme)) {
            uri.append(':').append(port);
        }
        uri.append('/').append(database);
        if (hasCredentials()) {
            uri.append("?authSource=admin");
        }
        return uri.toString();
    }

    /**
     * 인증 정보 설정 여부.
     */
    public boolean hasCredentials() {
        return username != null;
    }

    /**
     * host/port만 변경한 새 인스턴스 생성.
     */
    public MongoConfig withHost(String host, int port) {
        return new MongoConfig(scheme, host, port, database, username, password, serverSelectionTimeoutMs);
    }

    /**
     * database만 변경한 새 인스턴스 생성.
     */
    public MongoConfig withDatabase(String database) {
        return new MongoConfig(scheme, host, port, database, username, password, serverSelectionTimeoutMs);
    }

    /**
     * 인증 정보만 변경한 새 인스턴스 생성.
     */
    public MongoConfig withCredentials(String username, String password) {
        return new MongoConfig(scheme, host, port, database, username, password, serverSelectionTimeoutMs);
    }

    /**
     * serverSelectionTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public MongoConfig withServerSelectionTimeoutMs(long serverSelectionTimeoutMs) {
        return new MongoConfig(scheme, host, port, database, username, password, serverSelectionTimeoutMs);
    }

    /**
     * 비밀번호를 가린 문자열 표현.
     */
    @Override
    public String toString() {
        return "MongoConfig{scheme=" + scheme
            + ", host=" + host
            + ", port=" + port
            + ", database=" + database
            + ", username=" + username
            + ", password=" + (password == null ? "null" : "****")
            + ", serverSelectionTimeoutMs=" + serverSelectionTimeoutMs + "}";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
