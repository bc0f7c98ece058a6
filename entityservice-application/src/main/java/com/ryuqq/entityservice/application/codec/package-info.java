/**
 * JSON codec for command payloads, event payloads and store documents.
 *
 * <p>{@link com.ryuqq.entityservice.application.codec.PayloadCodec} wraps one configured Jackson
 * {@code ObjectMapper}; decoding failures surface as
 * {@link com.ryuqq.entityservice.application.codec.PayloadCodecException}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.application.codec;
