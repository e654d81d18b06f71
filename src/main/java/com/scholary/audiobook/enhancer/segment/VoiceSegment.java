package com.scholary.audiobook.enhancer.segment;

import com.scholary.audiobook.enhancer.annotation.VoiceRole;

/**
 * A run of chapter text read with one voice.
 *
 * <p>{@code text} is the raw chapter substring, {@code spokenText} the same text with markers
 * removed, ready for a synthesis engine.
 */
public record VoiceSegment(
    String text, String spokenText, VoiceRole role, double pauseBefore, double pauseAfter) {}
