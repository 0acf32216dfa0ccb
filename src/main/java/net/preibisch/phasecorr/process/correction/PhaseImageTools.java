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

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.util.RealSum;
import net.imglib2.view.Views;
import net.preibisch.phasecorr.process.fit.DimensionMismatchException;
import net.preibisch.phasecorr.process.fit.FlowEncoding;
import net.preibisch.phasecorr.process.fit.InlierMask;
import net.preibisch.phasecorr.process.fit.PointSet;

/**
 * Conversions between phase-contrast images with axes
 * {@code [dim1, dim2, slice, time, channel]} and flattened {@link PointSet}s.
 */
public class PhaseImageTools {

	public static final int SLICE_AXIS = 2;
	public static final int TIME_AXIS = 3;
	public static final int CHANNEL_AXIS = 4;

	private PhaseImageTools() {}

	/**
	 * Verify that phase and magnitude are 5d, have equal shapes and a channel
	 * axis matching {@code encoding}.
	 *
	 * @throws DimensionMismatchException otherwise
	 */
	public static void checkDimensions(
			final RandomAccessibleInterval<?> phase,
			final RandomAccessibleInterval<?> magnitude,
			final FlowEncoding encoding) {

		if (phase.numDimensions() != 5)
			throw new DimensionMismatchException("Phase data must have axes [dim1, dim2, slice, time, channel], but has " + phase.numDimensions() + " dimensions.");
		if (!Arrays.equals(Intervals.dimensionsAsLongArray(phase), Intervals.dimensionsAsLongArray(magnitude)))
			throw new DimensionMismatchException("Phase " + dimensionString(phase) + " and magnitude " + dimensionString(magnitude) + " differ in shape.");
		if (phase.dimension(CHANNEL_AXIS) != encoding.numChannels())
			throw new DimensionMismatchException(encoding + " requires " + encoding.numChannels() + " channels, but the data has " + phase.dimension(CHANNEL_AXIS) + ".");
		if (encoding == FlowEncoding.FLOW_2D && phase.dimension(SLICE_AXIS) != 1)
			throw new DimensionMismatchException("2d flow data must have a single slice, but has " + phase.dimension(SLICE_AXIS) + ".");
	}

	/**
	 * @param image axes {@code [dim1, dim2, slice, time, channel]}
	 * @return mean over time, axes {@code [dim1, dim2, slice, channel]}
	 */
	public static <T extends RealType<T>> ArrayImg<DoubleType, DoubleArray> timeAverage(final RandomAccessibleInterval<T> image) {

		final RandomAccessibleInterval<T> source = Views.zeroMin(image);
		final long[] dims = Intervals.dimensionsAsLongArray(source);
		final ArrayImg<DoubleType, DoubleArray> average = ArrayImgs.doubles(dims[0], dims[1], dims[2], dims[4]);

		final RandomAccess<T> in = source.randomAccess();
		final RandomAccess<DoubleType> out = average.randomAccess();
		final long numTimepoints = dims[TIME_AXIS];
		final long[] pos = new long[5];
		for (long c = 0; c < dims[4]; ++c) {
			for (long z = 0; z < dims[2]; ++z) {
				for (long y = 0; y < dims[1]; ++y) {
					for (long x = 0; x < dims[0]; ++x) {
						pos[0] = x;
						pos[1] = y;
						pos[2] = z;
						pos[4] = c;
						final RealSum sum = new RealSum();
						for (long t = 0; t < numTimepoints; ++t) {
							pos[3] = t;
							in.setPosition(pos);
							sum.add(in.get().getRealDouble());
						}
						out.setPosition(new long[] {x, y, z, c});
						out.get().set(sum.getSum() / numTimepoints);
					}
				}
			}
		}
		return average;
	}

	/**
	 * Threshold the time-averaged magnitude. With several channels the
	 * channel mean is thresholded.
	 *
	 * @param averageMagnitude axes {@code [dim1, dim2, slice, channel]}
	 * @param threshold pixels with magnitude strictly above are in the mask
	 * @return mask with axes {@code [dim1, dim2, slice]}
	 */
	public static ArrayImg<BitType, LongArray> magnitudeMask(
			final RandomAccessibleInterval<DoubleType> averageMagnitude,
			final double threshold) {

		final long[] dims = Intervals.dimensionsAsLongArray(averageMagnitude);
		final ArrayImg<BitType, LongArray> mask = ArrayImgs.bits(dims[0], dims[1], dims[2]);
		final RandomAccess<DoubleType> in = averageMagnitude.randomAccess();
		final RandomAccess<BitType> out = mask.randomAccess();
		final long numChannels = dims[3];
		for (long z = 0; z < dims[2]; ++z) {
			for (long y = 0; y < dims[1]; ++y) {
				for (long x = 0; x < dims[0]; ++x) {
					final RealSum sum = new RealSum();
					for (long c = 0; c < numChannels; ++c) {
						in.setPosition(new long[] {x, y, z, c});
						sum.add(in.get().get());
					}
					out.setPosition(new long[] {x, y, z});
					out.get().set(sum.getSum() / numChannels > threshold);
				}
			}
		}
		return mask;
	}

	/**
	 * Collect the time-averaged phase of every pixel, or of the pixels within
	 * {@code mask}, as a {@link PointSet}. Coordinates are pixel indices
	 * {@code (dim1, dim2)} for 2d flow and {@code (dim1, dim2, slice)} for 4d
	 * flow; points are ordered with {@code dim1} varying fastest.
	 *
	 * @param averagePhase axes {@code [dim1, dim2, slice, channel]}
	 * @param mask axes {@code [dim1, dim2, slice]}, or {@code null} for all pixels
	 * @param encoding flow encoding of the data
	 */
	public static PointSet toPointSet(
			final RandomAccessibleInterval<DoubleType> averagePhase,
			final RandomAccessibleInterval<BitType> mask,
			final FlowEncoding encoding) {

		final long[] dims = Intervals.dimensionsAsLongArray(averagePhase);
		final RandomAccess<BitType> maskAccess = mask == null ? null : mask.randomAccess();

		int n = 0;
		for (long z = 0; z < dims[2]; ++z)
			for (long y = 0; y < dims[1]; ++y)
				for (long x = 0; x < dims[0]; ++x)
					if (isSelected(maskAccess, x, y, z))
						++n;

		final int numChannels = encoding.numChannels();
		final double[][] targets = new double[numChannels][n];
		final double[][] coordinates = new double[encoding.numSpatialDimensions()][n];
		final RandomAccess<DoubleType> phase = averagePhase.randomAccess();

		int i = 0;
		for (long z = 0; z < dims[2]; ++z) {
			for (long y = 0; y < dims[1]; ++y) {
				for (long x = 0; x < dims[0]; ++x) {
					if (!isSelected(maskAccess, x, y, z))
						continue;
					coordinates[0][i] = x;
					coordinates[1][i] = y;
					if (encoding.numSpatialDimensions() == 3)
						coordinates[2][i] = z;
					for (int c = 0; c < numChannels; ++c) {
						phase.setPosition(new long[] {x, y, z, c});
						targets[c][i] = phase.get().get();
					}
					++i;
				}
			}
		}
		return new PointSet(targets, coordinates);
	}

	/**
	 * Write per-channel values back to the pixel positions of {@code points}.
	 *
	 * @param values {@code [channel][point]}
	 * @param points the points that define the positions
	 * @param target axes {@code [dim1, dim2, slice, channel]}
	 */
	public static void scatter(
			final double[][] values,
			final PointSet points,
			final RandomAccessibleInterval<DoubleType> target) {

		final RandomAccess<DoubleType> out = target.randomAccess();
		final long[] pos = new long[4];
		for (int i = 0; i < points.size(); ++i) {
			setSpatialPosition(points, i, pos);
			for (int c = 0; c < values.length; ++c) {
				pos[3] = c;
				out.setPosition(pos);
				out.get().set(values[c][i]);
			}
		}
	}

	/**
	 * Mark the inliers of {@code points} in {@code target}.
	 *
	 * @param target axes {@code [dim1, dim2, slice, channel]}
	 */
	public static void scatter(
			final InlierMask inliers,
			final PointSet points,
			final RandomAccessibleInterval<BitType> target) {

		final RandomAccess<BitType> out = target.randomAccess();
		final long[] pos = new long[4];
		for (int i = 0; i < points.size(); ++i) {
			setSpatialPosition(points, i, pos);
			for (int c = 0; c < inliers.numChannels(); ++c) {
				pos[3] = c;
				out.setPosition(pos);
				out.get().set(inliers.isInlier(c, i));
			}
		}
	}

	/**
	 * @param average axes {@code [dim1, dim2, slice, channel]}
	 * @param background same shape as {@code average}
	 * @return {@code average - background}
	 */
	public static ArrayImg<DoubleType, DoubleArray> subtract(
			final RandomAccessibleInterval<DoubleType> average,
			final RandomAccessibleInterval<DoubleType> background) {

		final long[] dims = Intervals.dimensionsAsLongArray(average);
		final ArrayImg<DoubleType, DoubleArray> corrected = ArrayImgs.doubles(dims);
		final Cursor<DoubleType> a = Views.flatIterable(average).cursor();
		final Cursor<DoubleType> b = Views.flatIterable(background).cursor();
		final Cursor<DoubleType> out = corrected.cursor();
		while (out.hasNext())
			out.next().set(a.next().get() - b.next().get());
		return corrected;
	}

	/**
	 * Subtract a static background from every time point.
	 *
	 * @param timeResolved axes {@code [dim1, dim2, slice, time, channel]}
	 * @param background axes {@code [dim1, dim2, slice, channel]}
	 * @return corrected data, axes {@code [dim1, dim2, slice, time, channel]}
	 */
	public static <T extends RealType<T>> ArrayImg<DoubleType, DoubleArray> subtractOverTime(
			final RandomAccessibleInterval<T> timeResolved,
			final RandomAccessibleInterval<DoubleType> background) {

		final RandomAccessibleInterval<T> source = Views.zeroMin(timeResolved);
		final long[] dims = Intervals.dimensionsAsLongArray(source);
		final ArrayImg<DoubleType, DoubleArray> corrected = ArrayImgs.doubles(dims);

		final Cursor<DoubleType> out = corrected.localizingCursor();
		final RandomAccess<T> in = source.randomAccess();
		final RandomAccess<DoubleType> bg = background.randomAccess();
		final long[] pos = new long[5];
		while (out.hasNext()) {
			out.fwd();
			out.localize(pos);
			in.setPosition(pos);
			bg.setPosition(new long[] {pos[0], pos[1], pos[2], pos[4]});
			out.get().set(in.get().getRealDouble() - bg.get().get());
		}
		return corrected;
	}

	private static void setSpatialPosition(final PointSet points, final int i, final long[] pos) {
		final double[][] coordinates = points.coordinates();
		pos[0] = (long) coordinates[0][i];
		pos[1] = (long) coordinates[1][i];
		pos[2] = coordinates.length == 3 ? (long) coordinates[2][i] : 0;
	}

	private static boolean isSelected(final RandomAccess<BitType> mask, final long x, final long y, final long z) {
		if (mask == null)
			return true;
		mask.setPosition(new long[] {x, y, z});
		return mask.get().get();
	}

	private static String dimensionString(final RandomAccessibleInterval<?> interval) {
		return Arrays.toString(Intervals.dimensionsAsLongArray(interval));
	}
}
