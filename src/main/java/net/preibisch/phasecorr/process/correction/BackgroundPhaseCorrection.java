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

import java.util.Random;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.preibisch.phasecorr.process.fit.BackgroundFit;
import net.preibisch.phasecorr.process.fit.FitException;
import net.preibisch.phasecorr.process.fit.FlowEncoding;
import net.preibisch.phasecorr.process.fit.PointSet;
import net.preibisch.phasecorr.process.fit.PolynomialBackgroundFit;
import net.preibisch.phasecorr.process.fit.PolynomialModel;
import net.preibisch.phasecorr.process.msac.MsacEstimator;
import net.preibisch.phasecorr.process.msac.MsacResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background phase correction of 2d or 4d flow data. Stationary tissue is
 * first approximated by a magnitude threshold and then refined by MSAC, the
 * background is fitted to the refined stationary tissue and subtracted from
 * every time point.
 */
public class BackgroundPhaseCorrection {

	private static final Logger LOG = LoggerFactory.getLogger(BackgroundPhaseCorrection.class);

	private BackgroundPhaseCorrection() {}

	/**
	 * Correct time-resolved phase data.
	 *
	 * @param phase phase normalized to [-1, 1), axes {@code [dim1, dim2, slice, time, channel]}
	 * @param magnitude magnitude normalized to [0, 1], same shape as {@code phase}
	 * @param parameters validated parameters
	 * @param rnd source of all random draws; equal seeds give equal results
	 * @return masks, model, background and corrected data
	 * @throws FitException if the mask holds fewer points than required or the final fit is singular
	 */
	public static <P extends RealType<P>, M extends RealType<M>> CorrectionResult correct(
			final RandomAccessibleInterval<P> phase,
			final RandomAccessibleInterval<M> magnitude,
			final CorrectionParameters parameters,
			final Random rnd) throws FitException {

		final long t0 = System.currentTimeMillis();
		final FlowEncoding encoding = parameters.encoding();
		PhaseImageTools.checkDimensions(phase, magnitude, encoding);

		final BackgroundFit msacFit = new PolynomialBackgroundFit(encoding, parameters.msacFitOrder());
		final BackgroundFit correctionFit = new PolynomialBackgroundFit(encoding, parameters.correctionFitOrder());
		final MsacEstimator msac = new MsacEstimator(
				msacFit,
				parameters.msacThreshold(),
				parameters.samples(),
				parameters.trials(),
				parameters.numThreads());

		final ArrayImg<DoubleType, DoubleArray> averageMagnitude = PhaseImageTools.timeAverage(magnitude);
		final ArrayImg<DoubleType, DoubleArray> averagePhase = PhaseImageTools.timeAverage(phase);
		final ArrayImg<BitType, LongArray> magnitudeMask = PhaseImageTools.magnitudeMask(averageMagnitude, parameters.magnitudeThreshold());

		final PointSet maskPoints = PhaseImageTools.toPointSet(averagePhase, magnitudeMask, encoding);
		final PointSet allPoints = PhaseImageTools.toPointSet(averagePhase, null, encoding);
		LOG.info("magnitude mask: {} of {} pixels above {}", maskPoints.size(), allPoints.size(), parameters.magnitudeThreshold());

		final long t1 = System.currentTimeMillis();
		final MsacResult msacResult = msac.estimate(maskPoints, rnd);
		final long timeMsac = System.currentTimeMillis() - t1;
		for (int c = 0; c < encoding.numChannels(); ++c)
			LOG.info("MSAC channel {}: {} of {} inliers, cost {}", c, msacResult.inliers().count(c), maskPoints.size(), msacResult.bestCost(c));
		LOG.info("MSAC took {} ms", timeMsac);

		final PolynomialModel model = correctionFit.fit(maskPoints, msacResult.inliers());
		LOG.info("correction model: {}", model);

		final long[] dims = Intervals.dimensionsAsLongArray(averagePhase);
		final ArrayImg<DoubleType, DoubleArray> background = ArrayImgs.doubles(dims);
		PhaseImageTools.scatter(correctionFit.evaluate(model, allPoints), allPoints, background);

		final ArrayImg<BitType, LongArray> msacMask = ArrayImgs.bits(dims);
		PhaseImageTools.scatter(msacResult.inliers(), maskPoints, msacMask);

		final ArrayImg<DoubleType, DoubleArray> correctedAverage = PhaseImageTools.subtract(averagePhase, background);
		final ArrayImg<DoubleType, DoubleArray> correctedTimeResolved = PhaseImageTools.subtractOverTime(phase, background);

		final long timeTotal = System.currentTimeMillis() - t0;
		LOG.info("background phase correction took {} ms", timeTotal);

		return new CorrectionResult(
				magnitudeMask,
				msacMask,
				msacResult,
				model,
				background,
				correctedAverage,
				correctedTimeResolved,
				timeMsac,
				timeTotal);
	}
}
