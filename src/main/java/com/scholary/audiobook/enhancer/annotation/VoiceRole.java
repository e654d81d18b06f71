package com.scholary.audiobook.enhancer.annotation;

/**
 * Symbolic voice tag used downstream to pick a synthesis voice.
 *
 * <p>Heading roles also carry the silence the narrator leaves around them.
 */
public enum VoiceRole {
  MAIN_TITLE("main_title_voice", 2.0, 1.5),
  CHAPTER("chapter_voice", 2.0, 1.5),
  SECTION("section_voice", 1.0, 0.8),
  SUBSECTION("subsection_voice", 1.0, 0.8),
  NARRATOR("main_narrator", 0.0, 0.0);

  private final String key;
  private final double pauseBefore;
  private final double pauseAfter;

  VoiceRole(String key, double pauseBefore, double pauseAfter) {
    this.key = key;
    this.pauseBefore = pauseBefore;
    this.pauseAfter = pauseAfter;
  }

  /** Role of a heading at the given depth; 4 and deeper are all subsections. */
  public static VoiceRole forDepth(int depth) {
    if (depth < 1) {
      throw new IllegalArgumentException("Heading depth must be >= 1: " + depth);
    }
    switch (depth) {
      case 1:
        return MAIN_TITLE;
      case 2:
        return CHAPTER;
      case 3:
        return SECTION;
      default:
        return SUBSECTION;
    }
  }

  public String getKey() {
    return key;
  }

  public double getPauseBefore() {
    return pauseBefore;
  }

  public double getPauseAfter() {
    return pauseAfter;
  }
}
