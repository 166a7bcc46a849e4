package com.shadowlayout.constants;

import java.awt.Color;

public class ShadowDefaults {
	// Shadow side flags, combined with bitwise OR
	public static final int FLAG_SIDES_TOP = 1;
	public static final int FLAG_SIDES_RIGHT = 2;
	public static final int FLAG_SIDES_BOTTOM = 4;
	public static final int FLAG_SIDES_LEFT = 8;
	public static final int FLAG_SIDES_ALL = 15;

	// Attribute defaults
	public static final int DEF_SHADOW_SIDES = FLAG_SIDES_ALL;
	public static final Color DEF_SHADOW_COLOR = Color.BLACK;
	public static final Color DEF_BORDER_COLOR = Color.WHITE;
	public static final float DEF_BORDER_WIDTH = 0F;
	public static final float DEF_SHADOW_WIDTH = 0F;
	public static final float DEF_CORNER_RADIUS = 0F;
	public static final float DEF_DX = 0F;
	public static final float DEF_DY = 0F;

	// Paint baseline
	public static final Color BASE_PAINT_COLOR = Color.WHITE;

	// The border rectangle sits inside the content rectangle by the border width divided by this.
	// Empirical: looks better than a half-width inset once borders get wide.
	public static final float BORDER_INSET_DIVISOR = 3F;

	// Blur radius to Gaussian sigma
	public static final float BLUR_SIGMA_SCALE = 0.57735F;
	public static final float BLUR_SIGMA_BIAS = 0.5F;

	// Screen resolution that maps to a density scale of 1.0
	public static final int BASELINE_DPI = 96;

	// Property keys
	public static final String KEY_PREFIX = "shadow.";
	public static final String KEY_SHADOW_COLOR = KEY_PREFIX + "shadowColor";
	public static final String KEY_SHADOW_WIDTH = KEY_PREFIX + "shadowWidth";
	public static final String KEY_DX = KEY_PREFIX + "dx";
	public static final String KEY_DY = KEY_PREFIX + "dy";
	public static final String KEY_CORNER_RADIUS = KEY_PREFIX + "cornerRadius";
	public static final String KEY_BORDER_COLOR = KEY_PREFIX + "borderColor";
	public static final String KEY_BORDER_WIDTH = KEY_PREFIX + "borderWidth";
	public static final String KEY_SHADOW_SIDES = KEY_PREFIX + "shadowSides";

	private ShadowDefaults() {
	}
}
