package org.doube.util;

import java.util.concurrent.atomic.AtomicReference;

import ij.Prefs;

/**
 * MultiThreading copyright 2007 Stephan Preibisch
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */

/**
 * Runs the same worker on a fixed number of threads and waits for all of them
 * to finish. Workers share their work through whatever the Runnable pulls
 * from, usually an AtomicInteger or a synchronized source.
 */
public class Multithreader {

	/**
	 * Run a task on numThreads threads and block until all have finished.
	 * With a single thread the task runs on the calling thread.
	 *
	 * @param run
	 * @param numThreads
	 *            number of worker threads, values below 1 mean ImageJ's
	 *            thread setting
	 * @throws RuntimeException
	 *             wrapping the first failure thrown by any worker, or the
	 *             interruption of the calling thread
	 */
	public static void startTask(final Runnable run, final int numThreads) {
		final int nThreads = threadCount(numThreads);
		if (nThreads == 1) {
			run.run();
			return;
		}
		final Thread[] threads = newThreads(nThreads);
		for (int ithread = 0; ithread < threads.length; ++ithread)
			threads[ithread] = new Thread(run, "Multithreader-" + ithread);
		startAndJoin(threads);
	}

	/**
	 * Resolve a requested number of threads
	 *
	 * @param requested
	 * @return requested if it is positive, otherwise ImageJ's thread setting
	 */
	public static int threadCount(final int requested) {
		if (requested > 0)
			return requested;
		return Math.max(1, Prefs.getThreads());
	}

	public static Thread[] newThreads(final int numThreads) {
		return new Thread[numThreads];
	}

	/**
	 * Start the threads and wait for them. If any thread dies with an
	 * uncaught exception, that exception is rethrown here once all threads
	 * have stopped.
	 *
	 * @param threads
	 */
	public static void startAndJoin(final Thread[] threads) {
		final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
		final Thread.UncaughtExceptionHandler handler = new Thread.UncaughtExceptionHandler() {
			@Override
			public void uncaughtException(final Thread t, final Throwable e) {
				failure.compareAndSet(null, e);
			}
		};
		for (int ithread = 0; ithread < threads.length; ++ithread) {
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].setUncaughtExceptionHandler(handler);
			threads[ithread].start();
		}

		try {
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (final InterruptedException ie) {
			for (final Thread thread : threads)
				thread.interrupt();
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}

		final Throwable t = failure.get();
		if (t instanceof RuntimeException)
			throw (RuntimeException) t;
		if (t instanceof Error)
			throw (Error) t;
		if (t != null)
			throw new RuntimeException(t);
	}
}
