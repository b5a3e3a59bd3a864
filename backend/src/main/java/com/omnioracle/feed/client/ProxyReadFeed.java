package com.omnioracle.feed.client;

public interface ProxyReadFeed {

    ProxyValue read();
}
