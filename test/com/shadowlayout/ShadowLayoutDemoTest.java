package com.shadowlayout;

import static org.junit.Assert.*;

import java.awt.Color;

import org.junit.Test;

import com.shadowlayout.config.ShadowConfig;
import com.shadowlayout.config.ShadowConfigLoader;

public class ShadowLayoutDemoTest {

	@Test
	public void builtInStyleIsOnTheClasspath() {
		ShadowConfig config = ShadowLayoutDemo.loadDefaultStyle(new ShadowConfigLoader(1F));

		assertEquals(new Color(0, 0, 0, 0x40), config.getShadowColor());
		assertEquals(10.5F, config.getShadowWidth(), 1e-6F);
		assertEquals(4.5F, config.getDy(), 1e-6F);
		assertEquals(8.5F, config.getCornerRadius(), 1e-6F);
		assertEquals(0F, config.getBorderWidth(), 0F);
		assertEquals(15, config.getShadowSidesMask());
	}
}
