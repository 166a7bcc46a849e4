package com.shadowlayout.config;

import static com.shadowlayout.constants.ShadowDefaults.*;

import java.awt.Color;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.regex.Pattern;
import java.util.logging.Logger;

import com.shadowlayout.util.LoggerSetup;

/**
 * Builds a {@link ShadowConfig} from named style properties.
 *
 * Lengths are read in display-independent units and converted to physical
 * pixels with the loader's density scale. A bad value is logged and replaced by
 * its default, so a typo in one key never discards the rest of the style.
 */
public class ShadowConfigLoader {
	private static final Logger logger = LoggerSetup.getLogger(ShadowConfigLoader.class);

	private static final Pattern HEX_DIGITS = Pattern.compile("[0-9A-Fa-f]+");

	private final float densityScale;

	public ShadowConfigLoader() {
		this(DisplayDensity.currentScale());
	}

	public ShadowConfigLoader(float densityScale) {
		if (!(densityScale > 0F)) {
			throw new IllegalArgumentException("Density scale must be > 0, got " + densityScale);
		}
		this.densityScale = densityScale;
	}

	public float getDensityScale() {
		return densityScale;
	}

	/**
	 * Reads a properties file. A missing or unreadable file yields the defaults.
	 */
	public ShadowConfig load(File file) {
		Properties props = new Properties();
		if (!file.exists()) {
			logger.info("No shadow style at " + file.getAbsolutePath() + ", using defaults");
			return fromProperties(props);
		}
		try (FileInputStream fis = new FileInputStream(file)) {
			props.load(fis);
			logger.info("Shadow style loaded from " + file.getAbsolutePath() + " (" + props.size() + " keys)");
		} catch (IOException e) {
			logger.severe("ShadowConfigLoader.load: " + e.getMessage());
			props.clear();
		}
		return fromProperties(props);
	}

	/**
	 * Reads a properties stream, typically a classpath resource.
	 */
	public ShadowConfig load(InputStream in) throws IOException {
		Properties props = new Properties();
		props.load(in);
		return fromProperties(props);
	}

	public ShadowConfig fromProperties(Properties props) {
		ShadowConfig.Builder b = ShadowConfig.builder();
		b.shadowColor(readColor(props, KEY_SHADOW_COLOR, DEF_SHADOW_COLOR));
		b.shadowWidth(readLength(props, KEY_SHADOW_WIDTH, DEF_SHADOW_WIDTH, false));
		b.dx(readLength(props, KEY_DX, DEF_DX, true));
		b.dy(readLength(props, KEY_DY, DEF_DY, true));
		b.cornerRadius(readLength(props, KEY_CORNER_RADIUS, DEF_CORNER_RADIUS, false));
		b.borderColor(readColor(props, KEY_BORDER_COLOR, DEF_BORDER_COLOR));
		b.borderWidth(readLength(props, KEY_BORDER_WIDTH, DEF_BORDER_WIDTH, false));

		String sides = props.getProperty(KEY_SHADOW_SIDES);
		if (sides == null) {
			b.shadowSidesMask(DEF_SHADOW_SIDES);
		} else {
			try {
				b.shadowSides(ShadowSide.parse(sides));
			} catch (IllegalArgumentException e) {
				logger.warning("Ignoring " + KEY_SHADOW_SIDES + "='" + sides + "': " + e.getMessage());
				b.shadowSidesMask(DEF_SHADOW_SIDES);
			}
		}
		return b.build();
	}

	private float readLength(Properties props, String key, float def, boolean signed) {
		String raw = props.getProperty(key);
		float value = def;
		if (raw != null) {
			try {
				value = Float.parseFloat(raw.trim());
				if (!Float.isFinite(value) || (!signed && value < 0F)) {
					logger.warning("Ignoring " + key + "='" + raw + "': out of range");
					value = def;
				}
			} catch (NumberFormatException e) {
				logger.warning("Ignoring " + key + "='" + raw + "': not a number");
				value = def;
			}
		}
		if (value < 0F) {
			// Round-to-nearest is symmetric for signed offsets
			return -DisplayDensity.toPixels(-value, densityScale);
		}
		return DisplayDensity.toPixels(value, densityScale);
	}

	private Color readColor(Properties props, String key, Color def) {
		String raw = props.getProperty(key);
		if (raw == null) {
			return def;
		}
		try {
			return parseColor(raw);
		} catch (IllegalArgumentException e) {
			logger.warning("Ignoring " + key + "='" + raw + "': " + e.getMessage());
			return def;
		}
	}

	/**
	 * Parses {@code #RRGGBB} or {@code #AARRGGBB}.
	 */
	public static Color parseColor(String text) {
		String s = text.trim();
		if (!s.startsWith("#")) {
			throw new IllegalArgumentException("Colour must start with '#'");
		}
		String hex = s.substring(1);
		if (!HEX_DIGITS.matcher(hex).matches()) {
			throw new IllegalArgumentException("Bad colour digits '" + hex + "'");
		}
		long value;
		try {
			value = Long.parseLong(hex, 16);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Bad colour digits '" + hex + "'");
		}
		if (hex.length() == 6) {
			return new Color((int) value | 0xFF000000, true);
		}
		if (hex.length() == 8) {
			return new Color((int) value, true);
		}
		throw new IllegalArgumentException("Colour needs 6 or 8 hex digits");
	}
}
