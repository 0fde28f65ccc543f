package com.example.fileingest.crawler;

public enum CrawlerState {
    IDLE,
    RUNNING,
    STOPPING
}
