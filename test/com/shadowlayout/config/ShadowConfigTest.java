package com.shadowlayout.config;

import static org.junit.Assert.*;

import java.awt.Color;
import java.util.EnumSet;

import org.junit.Test;

public class ShadowConfigTest {

	@Test
	public void defaultsMatchTheDocumentedAttributes() {
		ShadowConfig config = ShadowConfig.defaults();

		assertEquals(Color.BLACK, config.getShadowColor());
		assertEquals(0F, config.getShadowWidth(), 0F);
		assertEquals(0F, config.getDx(), 0F);
		assertEquals(0F, config.getDy(), 0F);
		assertEquals(0F, config.getCornerRadius(), 0F);
		assertEquals(Color.WHITE, config.getBorderColor());
		assertEquals(0F, config.getBorderWidth(), 0F);
		assertEquals(15, config.getShadowSidesMask());
	}

	@Test
	public void offsetsMayBeNegative() {
		ShadowConfig config = ShadowConfig.builder().offset(-3F, -7F).build();

		assertEquals(-3F, config.getDx(), 0F);
		assertEquals(-7F, config.getDy(), 0F);
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsNegativeShadowWidth() {
		ShadowConfig.builder().shadowWidth(-1F).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsNegativeCornerRadius() {
		ShadowConfig.builder().cornerRadius(-0.5F).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsNaNBorderWidth() {
		ShadowConfig.builder().borderWidth(Float.NaN).build();
	}

	@Test(expected = NullPointerException.class)
	public void rejectsNullColour() {
		ShadowConfig.builder().shadowColor(null);
	}

	@Test
	public void emptySideSetIsAllowed() {
		ShadowConfig config = ShadowConfig.builder().shadowSides(EnumSet.noneOf(ShadowSide.class)).build();

		assertEquals(0, config.getShadowSidesMask());
		assertFalse(config.hasShadowSide(ShadowSide.TOP));
	}

	@Test
	public void sideSetCannotBeModifiedFromOutside() {
		EnumSet<ShadowSide> sides = EnumSet.of(ShadowSide.TOP);
		ShadowConfig config = ShadowConfig.builder().shadowSides(sides).build();
		sides.add(ShadowSide.LEFT);

		assertEquals(EnumSet.of(ShadowSide.TOP), config.getShadowSides());
		try {
			config.getShadowSides().add(ShadowSide.RIGHT);
			fail("side set should be read-only");
		} catch (UnsupportedOperationException expected) {
			// read-only
		}
	}

	@Test
	public void toBuilderCopiesEveryField() {
		ShadowConfig config = ShadowConfig.builder()
				.shadowColor(new Color(10, 20, 30, 40))
				.shadowWidth(5F)
				.offset(1F, 2F)
				.cornerRadius(3F)
				.borderColor(Color.GREEN)
				.borderWidth(4F)
				.shadowSides(ShadowSide.LEFT, ShadowSide.BOTTOM)
				.build();

		assertEquals(config, config.toBuilder().build());
		assertEquals(config.hashCode(), config.toBuilder().build().hashCode());
		assertNotEquals(config, config.toBuilder().borderWidth(5F).build());
	}
}
