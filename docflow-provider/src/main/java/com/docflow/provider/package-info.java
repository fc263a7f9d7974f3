/**
 * Provider contract and registry.
 *
 * <ul>
 *   <li>{@link com.docflow.provider.ProviderInstance} – base contract; every instance has exactly one
 *       {@link com.docflow.provider.ProviderCapability}</li>
 *   <li>{@link com.docflow.provider.OcrProvider} – raw document to structured document</li>
 *   <li>{@link com.docflow.provider.VlmProvider} – document plus schema to JSON-like value</li>
 *   <li>{@link com.docflow.provider.ProviderRegistry} – ref to instance, built once and read-only</li>
 *   <li>{@link com.docflow.provider.ProviderException} – provider failure with optional HTTP status and Retry-After</li>
 * </ul>
 * Transport (HTTP clients, vendor SDKs) lives outside this module.
 */
package com.docflow.provider;
