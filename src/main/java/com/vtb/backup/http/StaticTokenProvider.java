package com.vtb.backup.http;

/**
 * Заранее полученный токен (например, из переменной окружения)
 */
public class StaticTokenProvider implements AccessTokenProvider {

    private final String token;

    public StaticTokenProvider(String token) {
        this.token = token;
    }

    @Override
    public String getAccessToken() {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException("Токен доступа не задан");
        }
        return token;
    }
}
