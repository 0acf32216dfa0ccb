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
package net.preibisch.phasecorr.process.msac;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import net.preibisch.phasecorr.process.fit.BackgroundFit;
import net.preibisch.phasecorr.process.fit.DesignMatrix;
import net.preibisch.phasecorr.process.fit.DimensionMismatchException;
import net.preibisch.phasecorr.process.fit.FitException;
import net.preibisch.phasecorr.process.fit.InlierMask;
import net.preibisch.phasecorr.process.fit.InsufficientSamplesException;
import net.preibisch.phasecorr.process.fit.InvalidConfigurationException;
import net.preibisch.phasecorr.process.fit.PointIndices;
import net.preibisch.phasecorr.process.fit.PointSet;
import net.preibisch.phasecorr.process.fit.PolynomialModel;
import net.preibisch.phasecorr.process.fit.SingularDesignException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * M-estimator sample consensus (MSAC) for background models. Every trial fits
 * a model to a random sample, scores it against all candidates with residuals
 * truncated at the threshold, and each channel keeps the cheapest model's
 * inliers. Always runs the configured number of trials.
 * <p>
 * P. H. S. Torr and A. Zisserman, "MLESAC: A New Robust Estimator with
 * Application to Estimating Image Geometry," Computer Vision and Image
 * Understanding, 2000.
 */
public class MsacEstimator
{
	private static final Logger LOG = LoggerFactory.getLogger( MsacEstimator.class );

	private final BackgroundFit fit;

	private final double threshold;

	private final int samples;

	private final int trials;

	private final int numThreads;

	public MsacEstimator( final BackgroundFit fit, final double threshold, final int samples, final int trials )
	{
		this( fit, threshold, samples, trials, 1 );
	}

	/**
	 * @param fit model used for the sampled candidates
	 * @param threshold maximal residual distance of an inlier, also the truncation of the cost
	 * @param samples number of points drawn per trial
	 * @param trials number of trials
	 * @param numThreads number of threads evaluating trials, the result does not depend on it
	 */
	public MsacEstimator(
			final BackgroundFit fit,
			final double threshold,
			final int samples,
			final int trials,
			final int numThreads )
	{
		if ( !( threshold > 0 ) || Double.isInfinite( threshold ) )
			throw new InvalidConfigurationException( "MSAC threshold must be positive and finite, but was " + threshold + "." );
		if ( samples < fit.getMinNumPoints() )
			throw new InvalidConfigurationException( "MSAC sample size " + samples + " is below the " + fit.getMinNumPoints() + " points required by a polynomial of order " + fit.order().degree() + "." );
		if ( trials < 1 )
			throw new InvalidConfigurationException( "Number of MSAC trials must be at least 1, but was " + trials + "." );
		if ( numThreads < 1 )
			throw new InvalidConfigurationException( "Number of threads must be at least 1, but was " + numThreads + "." );

		this.fit = fit;
		this.threshold = threshold;
		this.samples = samples;
		this.trials = trials;
		this.numThreads = numThreads;
	}

	public BackgroundFit fit()
	{
		return fit;
	}

	public double threshold()
	{
		return threshold;
	}

	public int samples()
	{
		return samples;
	}

	public int trials()
	{
		return trials;
	}

	/**
	 * Find the per-channel consensus set of {@code candidates}.
	 *
	 * @param candidates points to sample from and score against
	 * @param rnd source of all random draws of this run
	 * @return best cost and inliers per channel
	 * @throws FitException if there are fewer candidates than samples per trial
	 */
	public MsacResult estimate( final PointSet candidates, final Random rnd ) throws FitException
	{
		final int numChannels = fit.encoding().numChannels();
		if ( candidates.numChannels() != numChannels )
			throw new DimensionMismatchException( "Candidates have " + candidates.numChannels() + " channels, expected " + numChannels + "." );
		if ( !candidates.isFinite() )
			throw new IllegalArgumentException( "MSAC candidates contain non-finite values." );

		final int numCandidates = candidates.size();
		if ( numCandidates < samples )
			throw new InsufficientSamplesException( numCandidates, samples );

		// all draws happen up front so the result does not depend on scheduling
		final PointIndices[] draws = new PointIndices[ trials ];
		for ( int t = 0; t < trials; ++t )
		{
			draws[ t ] = new PointIndices( samples );
			draws[ t ].sample( rnd, numCandidates );
		}

		final DesignMatrix design = fit.designMatrix( candidates );
		final double initialCost = threshold * numCandidates;
		final double[][] trialCosts = new double[ trials ][];

		LOG.debug( "MSAC: {} candidates, {} channels, {} trials of {} samples, threshold {}", numCandidates, numChannels, trials, samples, threshold );

		final ConsensusState state;
		if ( numThreads == 1 || trials == 1 )
			state = evaluateTrials( candidates, design, draws, trialCosts, initialCost, 0, trials );
		else
			state = evaluateTrialsConcurrently( candidates, design, draws, trialCosts, initialCost );

		final double[][] costHistory = new double[ trials ][];
		final double[] best = new double[ numChannels ];
		Arrays.fill( best, initialCost );
		int numDegenerate = 0;
		for ( int t = 0; t < trials; ++t )
		{
			final double[] cost = trialCosts[ t ];
			if ( cost == null )
				++numDegenerate;
			else
				for ( int c = 0; c < numChannels; ++c )
					if ( cost[ c ] < best[ c ] )
						best[ c ] = cost[ c ];
			costHistory[ t ] = best.clone();
		}

		if ( numDegenerate > 0 )
			LOG.debug( "MSAC: {} of {} samples were degenerate", numDegenerate, trials );

		return new MsacResult( initialCost, state.cost, state.inliers, costHistory, numDegenerate );
	}

	private ConsensusState evaluateTrialsConcurrently(
			final PointSet candidates,
			final DesignMatrix design,
			final PointIndices[] draws,
			final double[][] trialCosts,
			final double initialCost ) throws FitException
	{
		final int numTasks = Math.min( numThreads, trials );
		final ExecutorService executor = Executors.newFixedThreadPool( numTasks );
		try
		{
			final List< Future< ConsensusState > > tasks = new ArrayList<>( numTasks );
			for ( int j = 0; j < numTasks; ++j )
			{
				final int from = ( int ) ( ( long ) trials * j / numTasks );
				final int to = ( int ) ( ( long ) trials * ( j + 1 ) / numTasks );
				tasks.add( executor.submit( () -> evaluateTrials( candidates, design, draws, trialCosts, initialCost, from, to ) ) );
			}

			// reduce in trial order, the earliest of equal costs wins as in a sequential run
			final ConsensusState state = new ConsensusState( initialCost, fit.encoding().numChannels(), candidates.size() );
			for ( final Future< ConsensusState > task : tasks )
				state.merge( task.get() );
			return state;
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException( e );
		}
		catch ( final ExecutionException e )
		{
			if ( e.getCause() instanceof FitException )
				throw ( FitException ) e.getCause();
			if ( e.getCause() instanceof RuntimeException )
				throw ( RuntimeException ) e.getCause();
			throw new RuntimeException( e.getCause() );
		}
		finally
		{
			executor.shutdown();
		}
	}

	private ConsensusState evaluateTrials(
			final PointSet candidates,
			final DesignMatrix design,
			final PointIndices[] draws,
			final double[][] trialCosts,
			final double initialCost,
			final int from,
			final int to ) throws FitException
	{
		final int numChannels = fit.encoding().numChannels();
		final int numCandidates = candidates.size();
		final ConsensusState state = new ConsensusState( initialCost, numChannels, numCandidates );

		for ( int t = from; t < to; ++t )
		{
			final PolynomialModel model;
			try
			{
				model = fit.fit( candidates.select( draws[ t ] ) );
			}
			catch ( final SingularDesignException e )
			{
				LOG.debug( "trial {}: degenerate sample ({})", t, e.getMessage() );
				continue;
			}

			final double[][] residuals = fit.distance( model, candidates, design );
			final double[] cost = new double[ numChannels ];
			for ( int c = 0; c < numChannels; ++c )
			{
				final double[] r = residuals[ c ];
				double sum = 0;
				for ( int i = 0; i < numCandidates; ++i )
					sum += r[ i ] < threshold ? r[ i ] : threshold;
				cost[ c ] = sum;

				if ( sum < state.cost[ c ] )
				{
					state.cost[ c ] = sum;
					for ( int i = 0; i < numCandidates; ++i )
						state.inliers.set( c, i, r[ i ] < threshold );
					LOG.debug( "trial {}: channel {} improved to cost {}", t, c, sum );
				}
			}
			trialCosts[ t ] = cost;
		}
		return state;
	}

	/**
	 * Best cost and inliers per channel over a range of trials.
	 */
	private static class ConsensusState
	{
		final double[] cost;

		final InlierMask inliers;

		ConsensusState( final double initialCost, final int numChannels, final int numCandidates )
		{
			cost = new double[ numChannels ];
			Arrays.fill( cost, initialCost );
			inliers = new InlierMask( numChannels, numCandidates );
		}

		void merge( final ConsensusState other )
		{
			for ( int c = 0; c < cost.length; ++c )
			{
				if ( other.cost[ c ] < cost[ c ] )
				{
					cost[ c ] = other.cost[ c ];
					inliers.set( c, other.inliers );
				}
			}
		}
	}
}
