package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans out bounded-concurrency page fetches and per-item conversions, merging whatever
 * succeeds.
 *
 * <p>
 * A collection runs in up to three stages, each on its own pool created for the call
 * and shut down before it returns:
 * <ol>
 * <li>fetch: one task per page, at most {@code maxFetchWorkers} at a time; raw elements
 * are concatenated in completion order</li>
 * <li>enrichment (optional): one detail call for each of the first
 * {@code maxEnrichedItems} elements</li>
 * <li>conversion: one task per element, at most {@code maxConversionWorkers} at a
 * time</li>
 * </ol>
 *
 * <p>
 * Every task has its own timeout, measured from the moment it starts running. A failed
 * or timed-out page contributes nothing, a failed conversion drops its element and a
 * failed enrichment keeps the raw element. Nothing is retried and the result carries no
 * ordering promise.
 *
 * @param <R> raw element type
 * @param <T> item type
 */
public final class ParallelCollector<R, T> {

	private static final Logger logger = LoggerFactory.getLogger(ParallelCollector.class);

	private static final long POLL_INTERVAL_MILLIS = 50;

	private final String name;

	private final PageFetcher<R> pageFetcher;

	private final ItemConverter<R, T> converter;

	private final @Nullable ItemEnricher<R> enricher;

	private final int maxFetchWorkers;

	private final int maxConversionWorkers;

	private final Duration fetchTimeout;

	private final Duration conversionTimeout;

	private final int maxItems;

	private final int maxEnrichedItems;

	private final int enrichmentWorkers;

	private final Duration enrichmentTimeout;

	private ParallelCollector(Builder<R, T> builder) {
		if (builder.pageFetcher == null || builder.converter == null) {
			throw new IllegalStateException("pageFetcher and converter are required");
		}
		this.name = builder.name;
		this.pageFetcher = builder.pageFetcher;
		this.converter = builder.converter;
		this.enricher = builder.enricher;
		this.maxFetchWorkers = builder.maxFetchWorkers;
		this.maxConversionWorkers = builder.maxConversionWorkers;
		this.fetchTimeout = builder.fetchTimeout;
		this.conversionTimeout = builder.conversionTimeout;
		this.maxItems = builder.maxItems;
		this.maxEnrichedItems = builder.maxEnrichedItems;
		this.enrichmentWorkers = builder.enrichmentWorkers;
		this.enrichmentTimeout = builder.enrichmentTimeout;
	}

	public static <R, T> Builder<R, T> builder() {
		return new Builder<>();
	}

	/**
	 * Number of pages needed for an estimate.
	 * @param totalEstimate expected number of items
	 * @param pageSize items per page
	 * @param maxPagesCeiling upper bound on pages
	 * @return {@code min(ceil(totalEstimate / pageSize), maxPagesCeiling)}, never negative
	 */
	static int pageCount(int totalEstimate, int pageSize, int maxPagesCeiling) {
		if (totalEstimate <= 0 || maxPagesCeiling <= 0) {
			return 0;
		}
		return Math.min((totalEstimate + pageSize - 1) / pageSize, maxPagesCeiling);
	}

	/**
	 * Collect a merged collection.
	 * @param credential bearer credential of the user
	 * @param totalEstimate expected number of items
	 * @param pageSize items per upstream page
	 * @param maxPagesCeiling upper bound on fetched pages
	 * @return converted items, in no particular order
	 * @throws AggregateFetchException if nothing could be collected while items were
	 * expected
	 */
	public List<T> collect(String credential, int totalEstimate, int pageSize, int maxPagesCeiling) {
		if (pageSize < 1) {
			throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
		}
		int pages = pageCount(totalEstimate, pageSize, maxPagesCeiling);
		if (pages == 0) {
			logger.debug("Nothing to collect for {} (estimate {})", name, totalEstimate);
			return List.of();
		}
		long start = System.currentTimeMillis();

		List<R> raw = fetchPages(credential, pages, pageSize);
		if (raw.size() > maxItems) {
			raw = new ArrayList<>(raw.subList(0, maxItems));
		}
		if (enricher != null && !raw.isEmpty()) {
			raw = enrich(enricher, credential, raw);
		}
		List<T> items = convert(raw);

		if (items.isEmpty() && totalEstimate > 0) {
			logger.error("Collecting {} failed: no items from {} pages ({} raw elements)", name, pages, raw.size());
			throw new AggregateFetchException("Failed to fetch " + name + ": all " + pages
					+ " pages or all of their items failed");
		}
		logger.info("Collected {} {} from {} pages ({} raw elements) in {}ms", items.size(), name, pages,
				raw.size(), System.currentTimeMillis() - start);
		return items;
	}

	private List<R> fetchPages(String credential, int pages, int pageSize) {
		List<Callable<List<R>>> tasks = new ArrayList<>(pages);
		for (int page = 1; page <= pages; page++) {
			int pageNumber = page;
			tasks.add(() -> pageFetcher.fetch(credential, pageNumber, pageSize));
		}
		List<R> raw = new ArrayList<>();
		for (Completed<List<R>> completed : runAll(tasks, Math.min(maxFetchWorkers, pages), fetchTimeout,
				"fetch")) {
			raw.addAll(completed.value());
		}
		logger.debug("Fetched {} raw {} from {} pages", raw.size(), name, pages);
		return raw;
	}

	private List<R> enrich(ItemEnricher<R> itemEnricher, String credential, List<R> raw) {
		int count = Math.min(maxEnrichedItems, raw.size());
		if (count <= 0) {
			return raw;
		}
		List<Callable<R>> tasks = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			R element = raw.get(i);
			tasks.add(() -> itemEnricher.enrich(credential, element));
		}
		List<R> enriched = new ArrayList<>(raw);
		List<Completed<R>> results = runAll(tasks, Math.min(enrichmentWorkers, count), enrichmentTimeout, "enrich");
		for (Completed<R> completed : results) {
			enriched.set(completed.index(), completed.value());
		}
		logger.debug("Enriched {}/{} {}", results.size(), count, name);
		return enriched;
	}

	private List<T> convert(List<R> raw) {
		if (raw.isEmpty()) {
			return List.of();
		}
		List<Callable<T>> tasks = new ArrayList<>(raw.size());
		for (R element : raw) {
			tasks.add(() -> converter.convert(element));
		}
		List<T> items = new ArrayList<>(raw.size());
		for (Completed<T> completed : runAll(tasks, Math.min(maxConversionWorkers, raw.size()), conversionTimeout,
				"convert")) {
			items.add(completed.value());
		}
		if (items.size() < raw.size()) {
			logger.warn("Dropped {} of {} {} that failed to convert", raw.size() - items.size(), raw.size(), name);
		}
		return items;
	}

	/**
	 * Run tasks on a fresh pool and return the successful results in completion order.
	 * Tasks that throw or outlive {@code timeout} are logged and left out.
	 */
	private <O> List<Completed<O>> runAll(List<Callable<O>> tasks, int workers, Duration timeout, String stage) {
		ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, workers),
				new NamedThreadFactory(name + "-" + stage));
		try {
			CompletionService<O> completionService = new ExecutorCompletionService<>(executor);
			Map<Future<O>, TimedTask<O>> pending = new HashMap<>();
			for (int i = 0; i < tasks.size(); i++) {
				TimedTask<O> task = new TimedTask<>(i, tasks.get(i));
				pending.put(completionService.submit(task), task);
			}

			List<Completed<O>> results = new ArrayList<>(tasks.size());
			long timeoutNanos = timeout.toNanos();
			while (!pending.isEmpty()) {
				Future<O> done = completionService.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
				if (done != null) {
					// null when the task was already cancelled for timing out
					TimedTask<O> task = pending.remove(done);
					if (task != null) {
						try {
							results.add(new Completed<>(task.index, done.get()));
						}
						catch (ExecutionException e) {
							Throwable cause = e.getCause() != null ? e.getCause() : e;
							logger.warn("{} {} task {} failed: {}", name, stage, task.index, cause.toString());
						}
					}
				}
				cancelExpired(pending, timeoutNanos, stage);
			}
			return results;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new AggregateFetchException("Interrupted while collecting " + name, e);
		}
		finally {
			executor.shutdownNow();
		}
	}

	private <O> void cancelExpired(Map<Future<O>, TimedTask<O>> pending, long timeoutNanos, String stage) {
		long now = System.nanoTime();
		Iterator<Map.Entry<Future<O>, TimedTask<O>>> iterator = pending.entrySet().iterator();
		while (iterator.hasNext()) {
			Map.Entry<Future<O>, TimedTask<O>> entry = iterator.next();
			if (entry.getValue().hasExpired(now, timeoutNanos)) {
				entry.getKey().cancel(true);
				iterator.remove();
				logger.warn("{} {} task {} timed out after {}ms", name, stage, entry.getValue().index,
						TimeUnit.NANOSECONDS.toMillis(timeoutNanos));
			}
		}
	}

	private record Completed<O>(int index, O value) {
	}

	/**
	 * Records when a worker picks the task up, so queued time does not count against its
	 * timeout.
	 */
	private static final class TimedTask<O> implements Callable<O> {

		private final int index;

		private final Callable<O> delegate;

		private volatile long startNanos;

		private volatile boolean started;

		private TimedTask(int index, Callable<O> delegate) {
			this.index = index;
			this.delegate = delegate;
		}

		@Override
		public O call() throws Exception {
			startNanos = System.nanoTime();
			started = true;
			return delegate.call();
		}

		private boolean hasExpired(long now, long timeoutNanos) {
			return started && now - startNanos >= timeoutNanos;
		}

	}

	private static final class NamedThreadFactory implements ThreadFactory {

		private final String prefix;

		private final AtomicInteger count = new AtomicInteger();

		private NamedThreadFactory(String prefix) {
			this.prefix = prefix;
		}

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, prefix + "-" + count.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

	/**
	 * Builder for {@link ParallelCollector}.
	 */
	public static final class Builder<R, T> {

		private String name = "items";

		private @Nullable PageFetcher<R> pageFetcher;

		private @Nullable ItemConverter<R, T> converter;

		private @Nullable ItemEnricher<R> enricher;

		private int maxFetchWorkers = 10;

		private int maxConversionWorkers = 200;

		private Duration fetchTimeout = Duration.ofSeconds(30);

		private Duration conversionTimeout = Duration.ofSeconds(30);

		private int maxItems = Integer.MAX_VALUE;

		private int maxEnrichedItems = 100;

		private int enrichmentWorkers = 5;

		private Duration enrichmentTimeout = Duration.ofSeconds(10);

		private Builder() {
		}

		/**
		 * Name used in log messages and thread names (e.g. "repos").
		 */
		public Builder<R, T> name(String name) {
			this.name = name;
			return this;
		}

		public Builder<R, T> pageFetcher(PageFetcher<R> pageFetcher) {
			this.pageFetcher = pageFetcher;
			return this;
		}

		public Builder<R, T> converter(ItemConverter<R, T> converter) {
			this.converter = converter;
			return this;
		}

		public Builder<R, T> enricher(@Nullable ItemEnricher<R> enricher) {
			this.enricher = enricher;
			return this;
		}

		public Builder<R, T> maxFetchWorkers(int maxFetchWorkers) {
			this.maxFetchWorkers = requirePositive(maxFetchWorkers, "maxFetchWorkers");
			return this;
		}

		public Builder<R, T> maxConversionWorkers(int maxConversionWorkers) {
			this.maxConversionWorkers = requirePositive(maxConversionWorkers, "maxConversionWorkers");
			return this;
		}

		public Builder<R, T> fetchTimeout(Duration fetchTimeout) {
			this.fetchTimeout = fetchTimeout;
			return this;
		}

		public Builder<R, T> conversionTimeout(Duration conversionTimeout) {
			this.conversionTimeout = conversionTimeout;
			return this;
		}

		/**
		 * Truncate the fetched elements to this many before enrichment and conversion.
		 */
		public Builder<R, T> maxItems(int maxItems) {
			this.maxItems = requirePositive(maxItems, "maxItems");
			return this;
		}

		public Builder<R, T> maxEnrichedItems(int maxEnrichedItems) {
			this.maxEnrichedItems = Math.max(0, maxEnrichedItems);
			return this;
		}

		public Builder<R, T> enrichmentWorkers(int enrichmentWorkers) {
			this.enrichmentWorkers = requirePositive(enrichmentWorkers, "enrichmentWorkers");
			return this;
		}

		public Builder<R, T> enrichmentTimeout(Duration enrichmentTimeout) {
			this.enrichmentTimeout = enrichmentTimeout;
			return this;
		}

		public ParallelCollector<R, T> build() {
			return new ParallelCollector<>(this);
		}

		private static int requirePositive(int value, String name) {
			if (value < 1) {
				throw new IllegalArgumentException(name + " must be positive: " + value);
			}
			return value;
		}

	}

}
