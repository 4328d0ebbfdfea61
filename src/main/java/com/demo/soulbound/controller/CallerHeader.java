package com.demo.soulbound.controller;

/** Header that names the calling identity on mutating requests. */
final class CallerHeader {
    static final String NAME = "X-Caller";

    private CallerHeader() {}
}
