package com.callshield.domain.evidence.service;

/**
 * Key-management collaborator that signs package hashes with a credential held by the system.
 */
public interface SigningService {

    String sign(String hash);

    boolean verify(String hash, String signature);

    String algorithm();
}
