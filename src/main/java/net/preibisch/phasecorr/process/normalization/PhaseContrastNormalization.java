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

import java.util.function.DoubleUnaryOperator;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Brings raw scanner data into the value ranges expected by the background
 * correction: phase in [-1, 1), magnitude in [0, 1].
 */
public class PhaseContrastNormalization {

	/**
	 * Value range of 12 bit phase images.
	 */
	public static final double DEFAULT_PHASE_RANGE = 4096;

	private PhaseContrastNormalization() {}

	public static <T extends RealType<T>> ArrayImg<DoubleType, DoubleArray> normalizePhase(final RandomAccessibleInterval<T> rawPhase) {
		return normalizePhase(rawPhase, DEFAULT_PHASE_RANGE);
	}

	/**
	 * Map raw phase values in {@code [0, range)} to {@code [-1, 1)}.
	 *
	 * @param rawPhase raw phase
	 * @param range number of raw phase values
	 */
	public static <T extends RealType<T>> ArrayImg<DoubleType, DoubleArray> normalizePhase(
			final RandomAccessibleInterval<T> rawPhase,
			final double range) {

		if (!(range > 0))
			throw new IllegalArgumentException("Phase range must be positive, but was " + range + ".");

		return scale(rawPhase, v -> (v / range - 0.5) * 2);
	}

	/**
	 * Divide by the peak magnitude (2d flow).
	 */
	public static <T extends RealType<T>> ArrayImg<DoubleType, DoubleArray> normalizeMagnitude(final RandomAccessibleInterval<T> magnitude) {
		final double peak = checkPeak(max(magnitude));
		return scale(magnitude, v -> v / peak);
	}

	/**
	 * Divide by the peak magnitude of the center slice {@code ceil(n / 2)}
	 * along the phase encoding axis (4d flow).
	 *
	 * @param magnitude magnitude
	 * @param phaseEncodingAxis axis along which the center slice is taken
	 */
	public static <T extends RealType<T>> ArrayImg<DoubleType, DoubleArray> normalizeMagnitude(
			final RandomAccessibleInterval<T> magnitude,
			final int phaseEncodingAxis) {

		final RandomAccessibleInterval<T> source = Views.zeroMin(magnitude);
		final long n = source.dimension(phaseEncodingAxis);
		final long center = Math.min((n + 1) / 2, n - 1);
		final double peak = checkPeak(max(Views.hyperSlice(source, phaseEncodingAxis, center)));
		return scale(source, v -> v / peak);
	}

	private static double checkPeak(final double peak) {
		if (!(peak > 0))
			throw new IllegalArgumentException("Cannot normalize magnitude with peak value " + peak + ".");
		return peak;
	}

	private static <T extends RealType<T>> double max(final RandomAccessibleInterval<T> image) {
		double max = Double.NEGATIVE_INFINITY;
		for (final T t : Views.flatIterable(image))
			max = Math.max(max, t.getRealDouble());
		return max;
	}

	static <T extends RealType<T>> ArrayImg<DoubleType, DoubleArray> scale(
			final RandomAccessibleInterval<T> source,
			final DoubleUnaryOperator op) {

		final ArrayImg<DoubleType, DoubleArray> result = ArrayImgs.doubles(Intervals.dimensionsAsLongArray(source));
		final Cursor<T> in = Views.flatIterable(source).cursor();
		final Cursor<DoubleType> out = result.cursor();
		while (out.hasNext())
			out.next().set(op.applyAsDouble(in.next().getRealDouble()));
		return result;
	}
}
