package io.recallr.memory.tier2;

/**
 * @param digests  indexed digests
 * @param themes   distinct themes
 * @param keywords distinct keywords
 */
public record IndexStats(int digests, int themes, int keywords) {
}
