/**
 * Service Provider Interfaces (SPI) for Response Mask SDK.
 *
 * <p>This package contains interfaces for extending SDK functionality:</p>
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.responsemask.spi.MaskRuleSource} - Custom rule declaration</li>
 *   <li>{@link io.github.hongjungwan.responsemask.spi.DeepCloneable} - Type-provided deep copy</li>
 * </ul>
 *
 * <h2>Registration:</h2>
 * <p>Register rule sources via ServiceLoader:</p>
 * <pre>
 * META-INF/services/io.github.hongjungwan.responsemask.spi.MaskRuleSource
 * </pre>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.responsemask.spi;
