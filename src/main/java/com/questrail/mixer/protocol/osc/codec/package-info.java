/**
 * OSC Codec
 * =============================================================================
 *
 * <p>The codec layer converts between UDP payloads and {@code OscMessage}s.
 * The byte-level work (address padding, type tag strings, big-endian argument
 * encoding, bundle framing) is delegated to JavaOSC; this package only owns
 * the boundary.</p>
 *
 * <pre>
 *   byte[] datagram
 *        → OscPacketDecoder        (JavaOSC parser, bundles flattened)
 *            → OscMessage
 *                → RequestCorrelator (match by address)
 * </pre>
 *
 * <h2>Important boundaries</h2>
 * <ul>
 *   <li>No address semantics live here: the codec does not know what
 *       {@code /ch/01/mix/fader} means.</li>
 *   <li>Decode failures are dropped, never turned into query failures. A
 *       query whose reply was corrupted simply times out.</li>
 * </ul>
 */
package com.questrail.mixer.protocol.osc.codec;
