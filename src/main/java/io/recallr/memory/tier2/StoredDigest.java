package io.recallr.memory.tier2;

public record StoredDigest(Digest digest, DigestLocation location) {
}
