package com.shadowlayout.geometry;

import static org.junit.Assert.*;

import java.awt.Insets;
import java.awt.geom.Rectangle2D;

import org.junit.Test;

public class GeometryResolverTest {

	private static void assertRect(float left, float top, float right, float bottom, Rectangle2D r) {
		assertEquals(left, r.getMinX(), 1e-4);
		assertEquals(top, r.getMinY(), 1e-4);
		assertEquals(right, r.getMaxX(), 1e-4);
		assertEquals(bottom, r.getMaxY(), 1e-4);
	}

	@Test
	public void contentRectIsSizeMinusPadding() {
		ContentGeometry g = GeometryResolver.onResize(100, 100, new Insets(14, 10, 14, 10), 0F);

		assertTrue(g.isResolved());
		assertRect(10F, 14F, 90F, 86F, g.getContentRect());
		assertFalse(g.getBorderRect().isPresent());
	}

	@Test
	public void contentRectIsExactForManySizes() {
		Insets padding = new Insets(3, 7, 5, 2);
		for (int w = 9; w <= 200; w += 17) {
			for (int h = 8; h <= 200; h += 23) {
				Rectangle2D r = GeometryResolver.onResize(w, h, padding, 0F).getContentRect();
				assertTrue(r.getMinX() <= r.getMaxX());
				assertTrue(r.getMinY() <= r.getMaxY());
				assertRect(7F, 3F, w - 2F, h - 5F, r);
			}
		}
	}

	@Test
	public void borderRectIsInsetByAThirdOfBorderWidth() {
		ContentGeometry g = GeometryResolver.onResize(100, 100, new Insets(14, 10, 14, 10), 6F);

		assertTrue(g.getBorderRect().isPresent());
		assertRect(12F, 16F, 88F, 84F, g.getBorderRect().get());
	}

	@Test
	public void borderRectExistsOnlyForPositiveWidth() {
		Insets none = new Insets(0, 0, 0, 0);

		assertFalse(GeometryResolver.onResize(50, 50, none, 0F).getBorderRect().isPresent());
		assertTrue(GeometryResolver.onResize(50, 50, none, 0.3F).getBorderRect().isPresent());
	}

	@Test
	public void zeroSizeGivesEmptyContentAtThePadding() {
		ContentGeometry g = GeometryResolver.onResize(0, 0, new Insets(4, 4, 4, 4), 0F);

		Rectangle2D r = g.getContentRect();
		assertRect(4F, 4F, 4F, 4F, r);
		assertTrue(r.isEmpty());
	}

	@Test
	public void paddingLargerThanSizeStillGivesWellFormedRect() {
		Rectangle2D r = GeometryResolver.onResize(10, 6, new Insets(4, 8, 4, 8), 0F).getContentRect();

		assertTrue(r.getMinX() <= r.getMaxX());
		assertTrue(r.getMinY() <= r.getMaxY());
		assertEquals(0D, r.getWidth(), 0D);
	}

	@Test
	public void unresolvedGeometryRefusesToHandOutRectangles() {
		assertFalse(ContentGeometry.UNRESOLVED.isResolved());
		assertFalse(ContentGeometry.UNRESOLVED.getBorderRect().isPresent());
		try {
			ContentGeometry.UNRESOLVED.getContentRect();
			fail("expected IllegalStateException");
		} catch (IllegalStateException expected) {
			// no size yet
		}
	}

	@Test
	public void returnedRectanglesAreCopies() {
		ContentGeometry g = GeometryResolver.onResize(40, 40, new Insets(0, 0, 0, 0), 3F);
		g.getContentRect().x = 99F;
		g.getBorderRect().get().y = 99F;

		assertEquals(0F, g.getContentRect().x, 0F);
		assertEquals(1F, g.getBorderRect().get().y, 1e-6F);
	}

	@Test(expected = IllegalArgumentException.class)
	public void negativeSizeIsRejected() {
		GeometryResolver.onResize(-1, 10, new Insets(0, 0, 0, 0), 0F);
	}
}
