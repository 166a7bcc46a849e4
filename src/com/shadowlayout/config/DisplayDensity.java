package com.shadowlayout.config;

import static com.shadowlayout.constants.ShadowDefaults.BASELINE_DPI;

import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.awt.Toolkit;

/**
 * Conversion from display-independent lengths to physical pixels.
 */
public final class DisplayDensity {

	private DisplayDensity() {
	}

	/**
	 * Round-to-nearest conversion; zero stays zero so that an unset length does
	 * not turn into half a pixel.
	 */
	public static float toPixels(float value, float scale) {
		return value == 0F ? 0F : value * scale + 0.5F;
	}

	/**
	 * Scale of the default screen relative to a 96 dpi display, or 1.0 when no
	 * screen is available.
	 */
	public static float currentScale() {
		if (GraphicsEnvironment.isHeadless()) {
			return 1F;
		}
		try {
			int dpi = Toolkit.getDefaultToolkit().getScreenResolution();
			return dpi > 0 ? (float) dpi / BASELINE_DPI : 1F;
		} catch (HeadlessException e) {
			return 1F;
		}
	}
}
