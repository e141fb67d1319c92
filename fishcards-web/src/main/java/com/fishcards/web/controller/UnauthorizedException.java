package com.fishcards.web.controller;

import com.fishcards.common.exception.FishcardsException;

/**
 * 请求未携带用户身份。
 */
public class UnauthorizedException extends FishcardsException {

    public UnauthorizedException(String message) {
        super("UNAUTHORIZED", message);
    }
}
