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
package net.preibisch.phasecorr.process.correction;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.phasecorr.process.fit.DimensionMismatchException;
import net.preibisch.phasecorr.process.fit.FitException;
import net.preibisch.phasecorr.process.fit.InsufficientSamplesException;

public class BackgroundPhaseCorrectionTest {

	private static final int SIZE = 20;
	private static final int NUM_TIMEPOINTS = 3;

	private static double plane(final int x, final int y) {
		return 0.1 + 0.01 * x - 0.005 * y;
	}

	/**
	 * 20 x 20 2d flow image, magnitude above threshold for x < 16 (80% of
	 * the pixels), phase is a plane with 5% of the masked pixels spiked.
	 */
	private static class Synthetic2D {

		final ArrayImg<DoubleType, DoubleArray> phase = ArrayImgs.doubles(SIZE, SIZE, 1, NUM_TIMEPOINTS, 1);
		final ArrayImg<DoubleType, DoubleArray> magnitude = ArrayImgs.doubles(SIZE, SIZE, 1, NUM_TIMEPOINTS, 1);
		final boolean[][] spiked = new boolean[SIZE][SIZE];

		Synthetic2D() {
			final List<int[]> maskPixels = new ArrayList<>();
			for (int y = 0; y < SIZE; ++y)
				for (int x = 0; x < 16; ++x)
					maskPixels.add(new int[] {x, y});
			Collections.shuffle(maskPixels, new Random(17));
			for (int k = 0; k < maskPixels.size() / 20; ++k)
				spiked[maskPixels.get(k)[0]][maskPixels.get(k)[1]] = true;

			for (int t = 0; t < NUM_TIMEPOINTS; ++t) {
				for (int y = 0; y < SIZE; ++y) {
					for (int x = 0; x < SIZE; ++x) {
						final double spike = spiked[x][y] ? ((x + y) % 2 == 0 ? 0.5 : -0.5) : 0;
						set(phase, plane(x, y) + spike + (t - 1) * 0.02, x, y, 0, t, 0);
						set(magnitude, x < 16 ? 0.5 : 0.01, x, y, 0, t, 0);
					}
				}
			}
		}
	}

	@Test
	public void testPlaneWithSpikes2D() throws FitException {

		final Synthetic2D data = new Synthetic2D();
		final CorrectionParameters parameters = CorrectionParameters.builder(1)
				.msacThreshold(0.01)
				.samples(3)
				.trials(100)
				.msacFitOrder(1)
				.correctionFitOrder(1)
				.build();

		final CorrectionResult result = BackgroundPhaseCorrection.correct(data.phase, data.magnitude, parameters, new Random(274612));

		int numMasked = 0;
		int numClean = 0;
		int numRecovered = 0;
		final List<Double> uncorrected = new ArrayList<>();
		final List<Double> corrected = new ArrayList<>();
		for (int y = 0; y < SIZE; ++y) {
			for (int x = 0; x < SIZE; ++x) {
				final boolean masked = get(result.magnitudeMask(), x, y, 0);
				assertEquals(x < 16, masked);
				if (!masked)
					continue;
				++numMasked;
				if (data.spiked[x][y]) {
					assertFalse(get(result.msacMask(), x, y, 0, 0));
					continue;
				}
				++numClean;
				if (get(result.msacMask(), x, y, 0, 0))
					++numRecovered;
				uncorrected.add(plane(x, y));
				corrected.add(get(result.correctedAverage(), x, y, 0, 0));
			}
		}

		assertEquals(320, numMasked);
		assertEquals(304, numClean);
		assertTrue(numRecovered >= 0.9 * numClean);
		assertTrue(variance(corrected) * 10 <= variance(uncorrected));
		assertEquals(numRecovered, result.inliers().count(0));
	}

	@Test
	public void testBackgroundIsSubtractedFromEveryTimepoint() throws FitException {

		final Synthetic2D data = new Synthetic2D();
		final CorrectionParameters parameters = CorrectionParameters.builder(1)
				.samples(3)
				.trials(60)
				.correctionFitOrder(2)
				.build();

		final CorrectionResult result = BackgroundPhaseCorrection.correct(data.phase, data.magnitude, parameters, new Random(3));

		for (int y = 0; y < SIZE; ++y) {
			for (int x = 0; x < SIZE; ++x) {
				final double background = get(result.background(), x, y, 0, 0);
				assertEquals(plane(x, y), background, 1e-9);
				for (int t = 0; t < NUM_TIMEPOINTS; ++t)
					assertEquals(
							get(data.phase, x, y, 0, t, 0) - background,
							get(result.correctedTimeResolved(), x, y, 0, t, 0),
							1e-12);
			}
		}
		assertEquals(6, result.model().numCoefficients());
		assertTrue(result.timeMsac() >= 0);
		assertTrue(result.timeTotal() >= result.timeMsac());
	}

	@Test
	public void testIndependentPlanes3D() throws FitException {

		final int sx = 8, sy = 8, sz = 4, nt = 2;
		final double[][] truth = {
				{0.05, 0.01, -0.004, 0.02},
				{-0.1, 0.003, 0.012, -0.01},
				{0.2, -0.008, 0.0, 0.015}};

		final ArrayImg<DoubleType, DoubleArray> phase = ArrayImgs.doubles(sx, sy, sz, nt, 3);
		final ArrayImg<DoubleType, DoubleArray> magnitude = ArrayImgs.doubles(sx, sy, sz, nt, 3);
		for (int c = 0; c < 3; ++c) {
			for (int t = 0; t < nt; ++t) {
				for (int z = 0; z < sz; ++z) {
					for (int y = 0; y < sy; ++y) {
						for (int x = 0; x < sx; ++x) {
							final double[] p = truth[c];
							final double spike = spikedIn(x, y, z) == c ? 0.6 : 0;
							set(phase, p[0] + p[1] * x + p[2] * y + p[3] * z + spike, x, y, z, t, c);
							set(magnitude, x == 0 && y == 0 ? 0.0 : 0.9, x, y, z, t, c);
						}
					}
				}
			}
		}

		final CorrectionParameters parameters = CorrectionParameters.builder(3)
				.samples(10)
				.trials(40)
				.correctionFitOrder(1)
				.build();
		final CorrectionResult result = BackgroundPhaseCorrection.correct(phase, magnitude, parameters, new Random(99));

		assertEquals(3, result.model().numChannels());
		for (int c = 0; c < 3; ++c) {
			assertArrayEquals(truth[c], result.model().coefficients(c), 1e-9);
			for (int other = 0; other < 3; ++other) {
				if (other == c)
					continue;
				double maxDifference = 0;
				for (int k = 0; k < 4; ++k)
					maxDifference = Math.max(maxDifference, Math.abs(result.model().coefficients(c)[k] - truth[other][k]));
				assertTrue(maxDifference > 1e-3);
			}
		}

		for (int z = 0; z < sz; ++z) {
			for (int y = 0; y < sy; ++y) {
				for (int x = 0; x < sx; ++x) {
					final boolean masked = !(x == 0 && y == 0);
					assertEquals(masked, get(result.magnitudeMask(), x, y, z));
					for (int c = 0; c < 3; ++c) {
						assertEquals(masked && spikedIn(x, y, z) != c, get(result.msacMask(), x, y, z, c));
						final double[] p = truth[c];
						assertEquals(p[0] + p[1] * x + p[2] * y + p[3] * z, get(result.background(), x, y, z, c), 1e-9);
					}
				}
			}
		}
	}

	@Test
	public void testSameSeedSameResult() throws FitException {

		final Synthetic2D data = new Synthetic2D();
		final CorrectionParameters parameters = CorrectionParameters.builder(1).samples(4).trials(20).build();

		final CorrectionResult a = BackgroundPhaseCorrection.correct(data.phase, data.magnitude, parameters, new Random(5));
		final CorrectionResult b = BackgroundPhaseCorrection.correct(data.phase, data.magnitude, parameters, new Random(5));

		assertArrayEquals(a.msac().bestCost(), b.msac().bestCost(), 0);
		assertArrayEquals(a.model().coefficients(0), b.model().coefficients(0), 0);
		assertArrayEquals(a.background().update(null).getCurrentStorageArray(), b.background().update(null).getCurrentStorageArray(), 0);
	}

	@Test(expected = InsufficientSamplesException.class)
	public void testEmptyMagnitudeMask() throws FitException {

		final ArrayImg<DoubleType, DoubleArray> phase = ArrayImgs.doubles(6, 6, 1, 2, 1);
		final ArrayImg<DoubleType, DoubleArray> magnitude = ArrayImgs.doubles(6, 6, 1, 2, 1);
		BackgroundPhaseCorrection.correct(phase, magnitude, CorrectionParameters.builder(1).build(), new Random(1));
	}

	@Test(expected = DimensionMismatchException.class)
	public void testChannelCountMismatch() throws FitException {

		final ArrayImg<DoubleType, DoubleArray> phase = ArrayImgs.doubles(6, 6, 2, 2, 3);
		final ArrayImg<DoubleType, DoubleArray> magnitude = ArrayImgs.doubles(6, 6, 2, 2, 3);
		BackgroundPhaseCorrection.correct(phase, magnitude, CorrectionParameters.builder(1).build(), new Random(1));
	}

	@Test(expected = DimensionMismatchException.class)
	public void testShapeMismatch() throws FitException {

		final ArrayImg<DoubleType, DoubleArray> phase = ArrayImgs.doubles(6, 6, 1, 2, 1);
		final ArrayImg<DoubleType, DoubleArray> magnitude = ArrayImgs.doubles(6, 5, 1, 2, 1);
		BackgroundPhaseCorrection.correct(phase, magnitude, CorrectionParameters.builder(1).build(), new Random(1));
	}

	@Test(expected = DimensionMismatchException.class)
	public void testMissingTimeAxis() throws FitException {

		final ArrayImg<DoubleType, DoubleArray> phase = ArrayImgs.doubles(6, 6, 1, 1);
		final ArrayImg<DoubleType, DoubleArray> magnitude = ArrayImgs.doubles(6, 6, 1, 1);
		BackgroundPhaseCorrection.correct(phase, magnitude, CorrectionParameters.builder(1).build(), new Random(1));
	}

	@Test(expected = DimensionMismatchException.class)
	public void testMultipleSlicesIn2D() throws FitException {

		final ArrayImg<DoubleType, DoubleArray> phase = ArrayImgs.doubles(6, 6, 2, 2, 1);
		final ArrayImg<DoubleType, DoubleArray> magnitude = ArrayImgs.doubles(6, 6, 2, 2, 1);
		BackgroundPhaseCorrection.correct(phase, magnitude, CorrectionParameters.builder(1).build(), new Random(1));
	}

	private static int spikedIn(final int x, final int y, final int z) {
		return (x + 3 * y + 5 * z) % 13;
	}

	private static double variance(final List<Double> values) {
		double mean = 0;
		for (final double v : values)
			mean += v;
		mean /= values.size();
		double sum = 0;
		for (final double v : values)
			sum += (v - mean) * (v - mean);
		return sum / values.size();
	}

	static void set(final RandomAccessibleInterval<DoubleType> img, final double value, final long... position) {
		final RandomAccess<DoubleType> access = img.randomAccess();
		access.setPosition(position);
		access.get().set(value);
	}

	static double get(final RandomAccessibleInterval<DoubleType> img, final long... position) {
		final RandomAccess<DoubleType> access = img.randomAccess();
		access.setPosition(position);
		return access.get().get();
	}

	static boolean get(final ArrayImg<BitType, ?> img, final long... position) {
		final RandomAccess<BitType> access = img.randomAccess();
		access.setPosition(position);
		return access.get().get();
	}
}
