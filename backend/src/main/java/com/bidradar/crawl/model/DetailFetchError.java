package com.bidradar.crawl.model;

public record DetailFetchError(String url, String error) {}
