package com.shadowlayout;

import java.awt.BorderLayout;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.FlowLayout;
import java.awt.Font;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Logger;

import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.SwingConstants;
import javax.swing.SwingUtilities;
import javax.swing.UIManager;
import javax.swing.UnsupportedLookAndFeelException;

import com.shadowlayout.config.ShadowConfig;
import com.shadowlayout.config.ShadowConfigLoader;
import com.shadowlayout.config.ShadowSide;
import com.shadowlayout.ui.ShadowLayout;
import com.shadowlayout.util.LoggerSetup;

/**
 * Opens a window with a few shadow cards.
 *
 * Usage: ShadowLayoutDemo [--debug | --quiet] [style.properties]
 */
public class ShadowLayoutDemo {
	private static final Logger logger = LoggerSetup.getLogger(ShadowLayoutDemo.class);

	private static final String DEFAULT_STYLE = "default-card.properties";

	public static void main(String[] args) {
		String stylePath = null;
		for (String arg : args) {
			if ("--debug".equals(arg)) {
				LoggerSetup.enableDebugLogging();
			} else if ("--quiet".equals(arg)) {
				LoggerSetup.setQuietMode();
			} else {
				stylePath = arg;
			}
		}

		try {
			UIManager.setLookAndFeel(UIManager.getSystemLookAndFeelClassName());
		} catch (ClassNotFoundException | InstantiationException | IllegalAccessException
				| UnsupportedLookAndFeelException e) {
			logger.warning("System look and feel unavailable: " + e.getMessage());
		}

		ShadowConfigLoader loader = new ShadowConfigLoader();
		ShadowConfig base = stylePath != null ? loader.load(new File(stylePath)) : loadDefaultStyle(loader);
		float scale = loader.getDensityScale();

		SwingUtilities.invokeLater(() -> createWindow(base, scale).setVisible(true));
	}

	static ShadowConfig loadDefaultStyle(ShadowConfigLoader loader) {
		try (InputStream in = ShadowLayoutDemo.class.getResourceAsStream(DEFAULT_STYLE)) {
			if (in == null) {
				logger.warning("Missing built-in style " + DEFAULT_STYLE + ", using defaults");
				return ShadowConfig.defaults();
			}
			return loader.load(in);
		} catch (IOException e) {
			logger.severe("Error loading built-in style: " + e.getMessage());
			return ShadowConfig.defaults();
		}
	}

	static JFrame createWindow(ShadowConfig base, float scale) {
		JFrame frame = new JFrame("Shadow Layout");
		frame.setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);

		JPanel canvas = new JPanel(new FlowLayout(FlowLayout.CENTER, 24, 24));
		canvas.setBackground(new Color(236, 239, 242));

		canvas.add(card("Default", base, new Color(255, 255, 255)));
		canvas.add(card("Bordered", base.toBuilder()
				.borderWidth(6F * scale)
				.borderColor(new Color(0, 168, 132))
				.build(), new Color(250, 250, 250)));
		canvas.add(card("Bottom only", base.toBuilder()
				.shadowSides(ShadowSide.BOTTOM)
				.offset(0F, 6F * scale)
				.cornerRadius(16F * scale)
				.build(), new Color(255, 244, 214)));
		canvas.add(card("Square", base.toBuilder()
				.cornerRadius(0F)
				.shadowColor(new Color(0, 0, 128, 90))
				.build(), new Color(220, 232, 255)));

		frame.add(canvas, BorderLayout.CENTER);
		frame.pack();
		frame.setLocationRelativeTo(null);
		return frame;
	}

	private static ShadowLayout card(String title, ShadowConfig config, Color background) {
		JLabel label = new JLabel(title, SwingConstants.CENTER);
		label.setFont(new Font("SansSerif", Font.BOLD, 14));
		label.setOpaque(true);
		label.setBackground(background);
		label.setPreferredSize(new Dimension(160, 100));

		ShadowLayout layout = new ShadowLayout(config);
		layout.add(label, BorderLayout.CENTER);
		return layout;
	}
}
