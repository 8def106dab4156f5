/**
 * Pure Java value types shared across all attest modules.
 *
 * <p>Hash value objects live in {@code shared/utils}.
 * This module has no dependencies.
 */
package com.libragraph.attest.types;
