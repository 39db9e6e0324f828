/**
 * Jackson bindings for the registry's v0 JSON API.
 *
 * <p>Unknown fields are ignored throughout.</p>
 */
package com.ryuqq.packsync.adapter.registry.dto;
