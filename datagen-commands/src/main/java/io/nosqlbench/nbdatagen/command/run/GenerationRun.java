package io.nosqlbench.nbdatagen.command.run;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import io.nosqlbench.nbdatagen.api.config.GenerationConfig;
import io.nosqlbench.nbdatagen.api.iteration.FlatteningIterable;
import io.nosqlbench.nbdatagen.api.model.Customer;
import io.nosqlbench.nbdatagen.api.model.Interaction;
import io.nosqlbench.nbdatagen.api.model.Transaction;
import io.nosqlbench.nbdatagen.core.CustomerProfile;
import io.nosqlbench.nbdatagen.core.GenerationContext;
import io.nosqlbench.nbdatagen.core.patterns.InjectedPatterns;
import io.nosqlbench.nbdatagen.core.patterns.PatternInjector;
import io.nosqlbench.nbdatagen.core.synthesis.InteractionSynthesizer;
import io.nosqlbench.nbdatagen.core.synthesis.TransactionSynthesizer;
import io.nosqlbench.nbdatagen.parquet.BatchWriter;
import io.nosqlbench.nbdatagen.parquet.TableWriteResult;
import io.nosqlbench.nbdatagen.parquet.codec.TableCodec;
import io.nosqlbench.nbdatagen.parquet.codec.TableCodecs;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/// One end to end generation: prepare the context, place the seed patterns, then write the
/// four tables.
///
/// Each table is an independent task on a fixed pool of `threads` workers. Every task
/// opens its own iterators, and every iterator derives its own random stream, so the
/// artifacts do not depend on the worker count. Within a table the seed pattern rows come
/// first, followed by the bulk rows.
public class GenerationRun {

  private static final Logger logger = LogManager.getLogger(GenerationRun.class);

  private final GenerationConfig config;

  /// @param config the validated configuration
  public GenerationRun(GenerationConfig config) {
    this.config = config;
  }

  /// Run the generation.
  /// @return per table results and the pattern report
  public RunReport execute() {
    long start = System.nanoTime();
    logger.info("Starting generation: {}", config);
    logger.info("Scale tier {}: expecting about {} transactions", config.scaleTier(),
        config.scaleTier().expectedTransactions(config.customerCount()));

    GenerationContext context = GenerationContext.prepare(config);
    InjectedPatterns injected = new PatternInjector(context).inject();
    logger.info("Placed {} pattern rows", injected.report().totalRows());

    Map<String, Callable<TableWriteResult>> tasks = new LinkedHashMap<>();
    task(tasks, TableCodecs.CUSTOMERS, customers(context));
    task(tasks, TableCodecs.PRODUCTS, context.catalog().all());
    task(tasks, TableCodecs.TRANSACTIONS, FlatteningIterable.<Transaction>concat(
        injected.transactions(), new TransactionSynthesizer(context).transactions()));
    task(tasks, TableCodecs.INTERACTIONS, FlatteningIterable.<Interaction>concat(
        injected.interactions(), new InteractionSynthesizer(context).interactions()));

    List<TableWriteResult> results = new ArrayList<>();
    ExecutorService pool = Executors.newFixedThreadPool(config.threads());
    try {
      List<String> tables = new ArrayList<>(tasks.keySet());
      List<Future<TableWriteResult>> futures = pool.invokeAll(tasks.values());
      for (int i = 0; i < futures.size(); i++) {
        results.add(collect(tables.get(i), futures.get(i)));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while writing tables", e);
    } finally {
      pool.shutdownNow();
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
    RunReport report = new RunReport(results, injected.report(), elapsed);
    logger.info("Generation finished: {} rows in {} ms", report.totalRows(), elapsed.toMillis());
    return report;
  }

  // a table that fails as a whole becomes a failed result instead of ending the run
  private static TableWriteResult collect(String table, Future<TableWriteResult> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Error error) {
        throw error;
      }
      logger.error("Table {} failed: {}", table, cause.getMessage(), cause);
      return TableWriteResult.failed(table, cause);
    }
  }

  private <T> void task(Map<String, Callable<TableWriteResult>> tasks, TableCodec<T> codec, Iterable<T> rows) {
    tasks.put(codec.table(), () -> {
      logger.debug("Writing table {}", codec.table());
      return BatchWriter.of(config, codec).write(rows);
    });
  }

  private static Iterable<Customer> customers(GenerationContext context) {
    return () -> new Iterator<>() {
      private final Iterator<CustomerProfile> profiles = context.population().iterator();

      @Override
      public boolean hasNext() {
        return profiles.hasNext();
      }

      @Override
      public Customer next() {
        return profiles.next().customer();
      }
    };
  }
}
