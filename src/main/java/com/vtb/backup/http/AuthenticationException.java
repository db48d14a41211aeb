package com.vtb.backup.http;

/**
 * Системная ошибка аутентификации. Единственный класс ошибок,
 * который прерывает весь прогон аудита.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
