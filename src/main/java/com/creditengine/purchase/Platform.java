package com.creditengine.purchase;

/**
 * Store the purchase was made through.
 */
public enum Platform {
    IOS,
    ANDROID,
    WEB
}
