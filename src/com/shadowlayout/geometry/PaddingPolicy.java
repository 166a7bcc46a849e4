package com.shadowlayout.geometry;

import java.awt.Insets;

import com.shadowlayout.config.ShadowConfig;
import com.shadowlayout.config.ShadowSide;

/**
 * Space each edge of the container reserves so the shadow is never clipped by
 * the container's own bounds.
 */
public final class PaddingPolicy {

	private PaddingPolicy() {
	}

	/**
	 * Horizontal reserve is shadow width + |dx|, vertical reserve is shadow
	 * width + |dy|, both truncated to whole pixels. An edge gets its axis'
	 * reserve only when its side is enabled.
	 */
	public static Insets computeInsets(ShadowConfig config) {
		int xPadding = (int) (config.getShadowWidth() + Math.abs(config.getDx()));
		int yPadding = (int) (config.getShadowWidth() + Math.abs(config.getDy()));

		return new Insets(
				config.hasShadowSide(ShadowSide.TOP) ? yPadding : 0,
				config.hasShadowSide(ShadowSide.LEFT) ? xPadding : 0,
				config.hasShadowSide(ShadowSide.BOTTOM) ? yPadding : 0,
				config.hasShadowSide(ShadowSide.RIGHT) ? xPadding : 0);
	}
}
