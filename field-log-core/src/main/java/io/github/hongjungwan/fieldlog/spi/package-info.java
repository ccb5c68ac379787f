/**
 * Service Provider Interface (SPI) for the Field Log SDK.
 *
 * <p>This package contains extension points for customizing SDK behavior.</p>
 *
 * <h2>Available SPIs:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.fieldlog.spi.ProcessTerminator} - What happens after a fatal record</li>
 * </ul>
 *
 * @since 1.0.0
 */
package io.github.hongjungwan.fieldlog.spi;
