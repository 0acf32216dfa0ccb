/*-
 * #%L
 * Robust background phase correction for phase-contrast MRI
 * velocity data using polynomial MSAC fits.
 * %%
 * Copyright (C) 2021 - 2025 Phase Background Correction developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.phasecorr.process.normalization;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Converts normalized phase to velocity.
 */
public class VelocityScaling {

	/**
	 * Display window in velocity units used for background images.
	 */
	public static final double DEFAULT_WINDOW = 10;

	private VelocityScaling() {}

	/**
	 * @param phase phase normalized to [-1, 1)
	 * @param venc maximal encoded velocity
	 * @return {@code phase * venc}
	 */
	public static <T extends RealType<T>> ArrayImg<DoubleType, DoubleArray> toVelocity(
			final RandomAccessibleInterval<T> phase,
			final double venc) {

		checkVenc(venc);
		return PhaseContrastNormalization.scale(phase, v -> v * venc);
	}

	/**
	 * Velocity clamped to {@code [-window, window]}.
	 */
	public static <T extends RealType<T>> ArrayImg<DoubleType, DoubleArray> toVelocity(
			final RandomAccessibleInterval<T> phase,
			final double venc,
			final double window) {

		checkVenc(venc);
		if (!(window > 0))
			throw new IllegalArgumentException("Display window must be positive, but was " + window + ".");

		return PhaseContrastNormalization.scale(phase, v -> Math.max(-window, Math.min(window, v * venc)));
	}

	private static void checkVenc(final double venc) {
		if (!(venc > 0))
			throw new IllegalArgumentException("venc must be positive, but was " + venc + ".");
	}
}
