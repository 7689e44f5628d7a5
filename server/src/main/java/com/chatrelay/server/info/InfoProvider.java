package com.chatrelay.server.info;

/**
 * One labelled fact about the running server.
 */
public interface InfoProvider {

    String key();

    String value();
}
