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

import net.preibisch.phasecorr.process.fit.FlowEncoding;
import net.preibisch.phasecorr.process.fit.InvalidConfigurationException;
import net.preibisch.phasecorr.process.fit.PolynomialOrder;

/**
 * Parameters of a background phase correction run. Phase values and
 * thresholds are in units of the normalized phase range [-1, 1), i.e.
 * fractions of venc; magnitudes are normalized to [0, 1].
 */
public class CorrectionParameters
{
	public static final double DEFAULT_MSAC_THRESHOLD = 0.01;
	public static final int DEFAULT_SAMPLES = 10;
	public static final int DEFAULT_TRIALS = 100;
	public static final int DEFAULT_MSAC_FIT_ORDER = 1;
	public static final int DEFAULT_CORRECTION_FIT_ORDER = 3;
	public static final double DEFAULT_MAGNITUDE_THRESHOLD_2D = 0.08;
	public static final double DEFAULT_MAGNITUDE_THRESHOLD_4D = 0.12;

	private final double magnitudeThreshold;
	private final double msacThreshold;
	private final int samples;
	private final int trials;
	private final PolynomialOrder msacFitOrder;
	private final PolynomialOrder correctionFitOrder;
	private final FlowEncoding encoding;
	private final int numThreads;

	private CorrectionParameters( final Builder builder )
	{
		this.encoding = FlowEncoding.fromFlowDimensions( builder.flowDimensions );
		this.msacFitOrder = PolynomialOrder.fromDegree( builder.msacFitOrder );
		this.correctionFitOrder = PolynomialOrder.fromDegree( builder.correctionFitOrder );

		if ( !( builder.magnitudeThreshold >= 0 && builder.magnitudeThreshold < 1 ) )
			throw new InvalidConfigurationException( "Magnitude threshold must be in [0, 1), but was " + builder.magnitudeThreshold + "." );
		if ( !( builder.msacThreshold > 0 ) || Double.isInfinite( builder.msacThreshold ) )
			throw new InvalidConfigurationException( "MSAC threshold must be positive and finite, but was " + builder.msacThreshold + "." );
		if ( builder.trials < 1 )
			throw new InvalidConfigurationException( "Number of MSAC trials must be at least 1, but was " + builder.trials + "." );
		if ( builder.numThreads < 1 )
			throw new InvalidConfigurationException( "Number of threads must be at least 1, but was " + builder.numThreads + "." );

		final int minSamples = msacFitOrder.numCoefficients( encoding.numSpatialDimensions() );
		if ( builder.samples < minSamples )
			throw new InvalidConfigurationException( "MSAC sample size " + builder.samples + " is below the " + minSamples + " points required by a polynomial of order " + msacFitOrder.degree() + " in " + encoding.numSpatialDimensions() + "d." );

		this.magnitudeThreshold = builder.magnitudeThreshold;
		this.msacThreshold = builder.msacThreshold;
		this.samples = builder.samples;
		this.trials = builder.trials;
		this.numThreads = builder.numThreads;
	}

	/**
	 * Start from the published defaults for the given number of flow encoding
	 * directions.
	 *
	 * @param flowDimensions 1 for 2d flow, 3 for 4d flow
	 */
	public static Builder builder( final int flowDimensions )
	{
		return new Builder( flowDimensions );
	}

	/**
	 * @return pixels with time-averaged magnitude above this value form the stationary tissue mask
	 */
	public double magnitudeThreshold()
	{
		return magnitudeThreshold;
	}

	/**
	 * @return maximal residual distance of an MSAC inlier
	 */
	public double msacThreshold()
	{
		return msacThreshold;
	}

	public int samples()
	{
		return samples;
	}

	public int trials()
	{
		return trials;
	}

	public PolynomialOrder msacFitOrder()
	{
		return msacFitOrder;
	}

	public PolynomialOrder correctionFitOrder()
	{
		return correctionFitOrder;
	}

	public FlowEncoding encoding()
	{
		return encoding;
	}

	public int flowDimensions()
	{
		return encoding.numChannels();
	}

	public int numThreads()
	{
		return numThreads;
	}

	@Override
	public String toString()
	{
		return "CorrectionParameters{" +
				"magnitudeThreshold=" + magnitudeThreshold +
				", msacThreshold=" + msacThreshold +
				", samples=" + samples +
				", trials=" + trials +
				", msacFitOrder=" + msacFitOrder.degree() +
				", correctionFitOrder=" + correctionFitOrder.degree() +
				", flowDimensions=" + encoding.numChannels() +
				", numThreads=" + numThreads +
				'}';
	}

	public static class Builder
	{
		private final int flowDimensions;
		private double magnitudeThreshold;
		private double msacThreshold = DEFAULT_MSAC_THRESHOLD;
		private int samples = DEFAULT_SAMPLES;
		private int trials = DEFAULT_TRIALS;
		private int msacFitOrder = DEFAULT_MSAC_FIT_ORDER;
		private int correctionFitOrder = DEFAULT_CORRECTION_FIT_ORDER;
		private int numThreads = 1;

		private Builder( final int flowDimensions )
		{
			this.flowDimensions = flowDimensions;
			this.magnitudeThreshold = flowDimensions == 3 ? DEFAULT_MAGNITUDE_THRESHOLD_4D : DEFAULT_MAGNITUDE_THRESHOLD_2D;
		}

		public Builder magnitudeThreshold( final double magnitudeThreshold )
		{
			this.magnitudeThreshold = magnitudeThreshold;
			return this;
		}

		public Builder msacThreshold( final double msacThreshold )
		{
			this.msacThreshold = msacThreshold;
			return this;
		}

		public Builder samples( final int samples )
		{
			this.samples = samples;
			return this;
		}

		public Builder trials( final int trials )
		{
			this.trials = trials;
			return this;
		}

		public Builder msacFitOrder( final int msacFitOrder )
		{
			this.msacFitOrder = msacFitOrder;
			return this;
		}

		public Builder correctionFitOrder( final int correctionFitOrder )
		{
			this.correctionFitOrder = correctionFitOrder;
			return this;
		}

		public Builder numThreads( final int numThreads )
		{
			this.numThreads = numThreads;
			return this;
		}

		/**
		 * @throws InvalidConfigurationException if any value is out of range
		 */
		public CorrectionParameters build()
		{
			return new CorrectionParameters( this );
		}
	}
}
