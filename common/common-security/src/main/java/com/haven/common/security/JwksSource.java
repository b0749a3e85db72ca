package com.haven.common.security;

import reactor.core.publisher.Mono;

import java.security.Key;
import java.util.Map;

/**
 * Remote provider of verification keys, indexed by key id.
 */
@FunctionalInterface
public interface JwksSource {

    Mono<Map<String, Key>> fetchKeys();
}
