/**
 * Public API for Response Mask SDK.
 *
 * <p>This package contains all public interfaces and classes that users
 * should interact with directly. Classes in this package are stable and
 * follow semantic versioning.</p>
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.responsemask.api.ResponseMasker} - Masking entry point</li>
 *   <li>{@link io.github.hongjungwan.responsemask.api.ResponseMaskerFactory} - Masker construction</li>
 *   <li>{@link io.github.hongjungwan.responsemask.api.annotation.MaskWhen} - Declarative member rules</li>
 *   <li>{@link io.github.hongjungwan.responsemask.api.config.MaskConfig} - SDK configuration</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * public class Category {
 *     @MaskWhen(policies = "public")
 *     private String name;
 *     private List<Category> children = new ArrayList<>();
 * }
 *
 * ResponseMasker masker = ResponseMaskerFactory.getDefault();
 * Category masked = masker.mask(category, "public");  // name == null at every depth
 * }</pre>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.responsemask.api;
