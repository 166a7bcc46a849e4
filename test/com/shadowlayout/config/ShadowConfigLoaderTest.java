package com.shadowlayout.config;

import static org.junit.Assert.*;

import java.awt.Color;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.EnumSet;
import java.util.Properties;

import org.junit.Test;

public class ShadowConfigLoaderTest {

	private static Properties props(String... pairs) {
		Properties p = new Properties();
		for (int i = 0; i < pairs.length; i += 2) {
			p.setProperty(pairs[i], pairs[i + 1]);
		}
		return p;
	}

	@Test
	public void lengthsAreConvertedToPhysicalPixels() {
		ShadowConfigLoader loader = new ShadowConfigLoader(2F);

		ShadowConfig config = loader.fromProperties(props(
				"shadow.shadowWidth", "10",
				"shadow.cornerRadius", "8",
				"shadow.borderWidth", "1.5",
				"shadow.dx", "0",
				"shadow.dy", "-3"));

		assertEquals(20.5F, config.getShadowWidth(), 1e-6F);
		assertEquals(16.5F, config.getCornerRadius(), 1e-6F);
		assertEquals(3.5F, config.getBorderWidth(), 1e-6F);
		assertEquals(0F, config.getDx(), 0F);
		assertEquals(-6.5F, config.getDy(), 1e-6F);
	}

	@Test
	public void zeroStaysZeroAfterConversion() {
		assertEquals(0F, DisplayDensity.toPixels(0F, 3F), 0F);
		assertEquals(3.5F, DisplayDensity.toPixels(1F, 3F), 1e-6F);
	}

	@Test
	public void emptyPropertiesGiveDefaults() {
		assertEquals(ShadowConfig.defaults(), new ShadowConfigLoader(1F).fromProperties(new Properties()));
	}

	@Test
	public void coloursAcceptRgbAndArgb() {
		ShadowConfig config = new ShadowConfigLoader(1F).fromProperties(props(
				"shadow.shadowColor", "#80102030",
				"shadow.borderColor", "#00FF00"));

		assertEquals(new Color(0x10, 0x20, 0x30, 0x80), config.getShadowColor());
		assertEquals(new Color(0, 255, 0, 255), config.getBorderColor());
	}

	@Test
	public void sidesAcceptNamesOrMask() {
		ShadowConfigLoader loader = new ShadowConfigLoader(1F);

		assertEquals(EnumSet.of(ShadowSide.TOP, ShadowSide.LEFT),
				loader.fromProperties(props("shadow.shadowSides", "top|left")).getShadowSides());
		assertEquals(6, loader.fromProperties(props("shadow.shadowSides", "6")).getShadowSidesMask());
	}

	@Test
	public void badValuesFallBackToDefaultsIndividually() {
		ShadowConfig config = new ShadowConfigLoader(1F).fromProperties(props(
				"shadow.shadowWidth", "wide",
				"shadow.cornerRadius", "-4",
				"shadow.shadowColor", "black",
				"shadow.shadowSides", "diagonal",
				"shadow.borderWidth", "2"));

		assertEquals(0F, config.getShadowWidth(), 0F);
		assertEquals(0F, config.getCornerRadius(), 0F);
		assertEquals(Color.BLACK, config.getShadowColor());
		assertEquals(15, config.getShadowSidesMask());
		assertEquals(2.5F, config.getBorderWidth(), 1e-6F);
	}

	@Test
	public void missingFileGivesDefaults() {
		File missing = new File("does-not-exist-" + System.nanoTime() + ".properties");

		assertEquals(ShadowConfig.defaults(), new ShadowConfigLoader(1F).load(missing));
	}

	@Test
	public void loadsFromFileAndStream() throws Exception {
		File file = Files.createTempFile("shadow-style", ".properties").toFile();
		file.deleteOnExit();
		try (FileOutputStream out = new FileOutputStream(file)) {
			props("shadow.cornerRadius", "6", "shadow.borderColor", "#112233").store(out, null);
		}
		ShadowConfigLoader loader = new ShadowConfigLoader(1F);

		ShadowConfig fromFile = loader.load(file);
		assertEquals(6.5F, fromFile.getCornerRadius(), 1e-6F);
		assertEquals(new Color(0x11, 0x22, 0x33), fromFile.getBorderColor());

		byte[] text = "shadow.dx=2\n".getBytes(StandardCharsets.ISO_8859_1);
		assertEquals(2.5F, loader.load(new ByteArrayInputStream(text)).getDx(), 1e-6F);
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsNonPositiveDensity() {
		new ShadowConfigLoader(0F);
	}

	@Test(expected = IllegalArgumentException.class)
	public void parseColorRejectsWrongLength() {
		ShadowConfigLoader.parseColor("#1234");
	}

	@Test(expected = IllegalArgumentException.class)
	public void parseColorRejectsSignedDigits() {
		ShadowConfigLoader.parseColor("#-12345");
	}

	@Test
	public void signedColourFallsBackToDefault() {
		ShadowConfig config = new ShadowConfigLoader(1F).fromProperties(props(
				"shadow.borderColor", "#+1234567"));

		assertEquals(Color.WHITE, config.getBorderColor());
	}
}
