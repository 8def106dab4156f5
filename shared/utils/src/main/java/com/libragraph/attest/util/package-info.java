/**
 * Shared utilities for all attest modules.
 *
 * <p>Contains {@link com.libragraph.attest.util.ContentHash} (BLAKE3-256) and
 * {@link com.libragraph.attest.util.ContentHasher}, the length-prefixed, domain-separated
 * hasher every fingerprint in the system is built with.
 * No framework dependencies, only Apache commons-codec for BLAKE3.
 */
package com.libragraph.attest.util;
