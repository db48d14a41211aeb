package com.vtb.backup.http;

/**
 * Источник токена доступа к management API.
 * Получение токена (tenant, учетные данные) выполняется вне ядра аудита.
 */
@FunctionalInterface
public interface AccessTokenProvider {

    /**
     * @return bearer токен без префикса
     * @throws AuthenticationException если токен получить невозможно (прогон прерывается)
     */
    String getAccessToken();
}
