/**
 * ONC RPC Wire Codec
 * =============================================================================
 *
 * <p>Byte-level mechanics of ONC RPC (RFC 1057) and XDR (RFC 1014):</p>
 * <ul>
 *   <li>Record marking: 4-byte fragment headers on a TCP stream</li>
 *   <li>XDR primitives: big-endian 32-bit integers, booleans, variable-length
 *       opaque data padded to four bytes</li>
 * </ul>
 *
 * <pre>
 *   TCP stream
 *        → RecordMarking   (fragments reassembled into one message)
 *            → XdrDecoder  (typed fields)
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>No knowledge of call/reply headers, programs or procedures.</li>
 *   <li>Works on plain {@code byte[]} and {@code java.io} streams only.</li>
 * </ul>
 */
package com.questrail.instrument.protocol.oncrpc.codec;
