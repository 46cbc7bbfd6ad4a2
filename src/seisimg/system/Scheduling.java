package seisimg.system;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

/**
 * Singleton class that contains the thread pool used to run independent units
 * of work, such as decoding many image files, in parallel.
 */
public class Scheduling
{
	/**
	 * Singleton instance
	 */
	private static final Scheduling g_oScheduling = new Scheduling();


	/**
	 * Thread pool, created on first use
	 */
	private ExecutorService m_iExecutor = null;


	/**
	 * Counter used to name the pool threads
	 */
	private static final AtomicInteger m_nThreadCount = new AtomicInteger();


	private final Logger m_oLogger = LogManager.getLogger(Scheduling.class);


	/**
	 * Default constructor. Does nothing.
	 */
	private Scheduling()
	{
	}


	/**
	 * Gets the singleton instance
	 *
	 * @return The singleton instance
	 */
	public static Scheduling getInstance()
	{
		return g_oScheduling;
	}


	/**
	 * Creates the thread pool if it does not exist yet. The number of threads
	 * comes from the {@code threads} key of the Scheduling configuration and
	 * defaults to the number of available processors.
	 *
	 * @return the thread pool
	 */
	private synchronized ExecutorService getExecutor()
	{
		if (m_iExecutor == null)
		{
			JSONObject oConfig = Config.getInstance().getConfig(getClass().getName(), "Scheduling");
			int nThreads = oConfig.optInt("threads", Runtime.getRuntime().availableProcessors());
			if (nThreads < 1)
				nThreads = 1;
			ThreadFactory iFactory = (Runnable iRunnable) ->
			{
				Thread oThread = new Thread(iRunnable, "seisimg-" + m_nThreadCount.incrementAndGet());
				oThread.setDaemon(true);
				return oThread;
			};
			m_iExecutor = Executors.newFixedThreadPool(nThreads, iFactory);
			m_oLogger.debug(String.format("Created thread pool with %d threads", nThreads));
		}
		return m_iExecutor;
	}


	public <T> Future<T> submit(Callable<T> oWork)
	{
		return getExecutor().submit(oWork);
	}


	/**
	 * Runs all of the given callables on the thread pool and waits for them to
	 * finish. Results are returned in the same order as the callables.
	 *
	 * @param <T> result type
	 * @param oCallables work to execute
	 * @return results of the callables, in order
	 * @throws ExecutionException the first failure in callable order; the
	 * remaining work is cancelled
	 * @throws InterruptedException if the calling thread is interrupted while
	 * waiting
	 */
	public <T> List<T> processCallables(List<? extends Callable<T>> oCallables)
		throws ExecutionException, InterruptedException
	{
		ArrayList<Future<T>> oTasks = new ArrayList(oCallables.size());
		for (Callable<T> oCallable : oCallables)
			oTasks.add(submit(oCallable)); // submit work to thread pool

		ArrayList<T> oResults = new ArrayList(oTasks.size());
		try
		{
			for (Future<T> oTask : oTasks)
				oResults.add(oTask.get());
		}
		finally
		{
			for (Future<T> oTask : oTasks)
			{
				if (!oTask.isDone())
					oTask.cancel(true);
			}
		}
		return oResults;
	}
}
