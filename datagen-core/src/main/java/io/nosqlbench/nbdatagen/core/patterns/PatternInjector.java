package io.nosqlbench.nbdatagen.core.patterns;

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


import io.nosqlbench.nbdatagen.api.model.Category;
import io.nosqlbench.nbdatagen.api.model.Channel;
import io.nosqlbench.nbdatagen.api.model.Interaction;
import io.nosqlbench.nbdatagen.api.model.Money;
import io.nosqlbench.nbdatagen.api.model.Product;
import io.nosqlbench.nbdatagen.api.model.Segment;
import io.nosqlbench.nbdatagen.api.model.Transaction;
import io.nosqlbench.nbdatagen.api.model.TransactionStatus;
import io.nosqlbench.nbdatagen.api.random.DeterministicIds;
import io.nosqlbench.nbdatagen.api.random.RandomGenerators;
import io.nosqlbench.nbdatagen.api.random.StreamKind;
import io.nosqlbench.nbdatagen.core.CustomerProfile;
import io.nosqlbench.nbdatagen.core.GenerationContext;
import io.nosqlbench.nbdatagen.core.seed.SeedCatalog;
import io.nosqlbench.nbdatagen.core.synthesis.InteractionSynthesizer;
import io.nosqlbench.nbdatagen.core.synthesis.RecencyTimestampSampler;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Places transactions on seed entities so that each [Pattern] is present in the output.
///
/// Only amount, quantity, channel and the time jitter are random; who buys what is fixed by
/// seed index. A pattern whose seed customers or products are missing is skipped with a
/// warning and listed as skipped in the [PatternReport].
///
/// Pattern transactions cost the product price times a factor in `[0.9, 1.3)`, have a quantity
/// of 1 or 2, are completed, and happen 1 to 90 days before the reference instant unless the
/// pattern fixes the time.
public class PatternInjector {
  private static final Logger logger = LogManager.getLogger(PatternInjector.class);

  /// VIP seed customers in `[5, 8)` are churn risks
  static final int CHURN_FROM = 5;
  static final int CHURN_TO = 8;
  /// Chain `k` uses seed customers with index `k` and `k + CHAIN_PARTNER_OFFSET`
  static final int CHAIN_PARTNER_OFFSET = 5;
  /// Chains may only use seed indexes below this, which keeps them off churn and gap customers
  static final int CHAIN_LIMIT = 5;

  private final GenerationContext context;

  /// @param context the run context
  public PatternInjector(GenerationContext context) {
    this.context = context;
  }

  /// Customers whose purchase history is owned by a pattern. Bulk synthesis adds nothing
  /// to them.
  /// @param seeds the seed catalog
  /// @return ids of the churn risk customers
  public static Set<String> reservedCustomerIds(SeedCatalog seeds) {
    Set<String> ids = new LinkedHashSet<>();
    for (CustomerProfile profile : seeds.customers(Segment.TOP_TIER, CHURN_FROM, CHURN_TO)) {
      ids.add(profile.customerId());
    }
    return Set.copyOf(ids);
  }

  /// Place every pattern. Each call starts the pattern stream over and returns equal rows.
  /// @return the placed rows and the report
  public InjectedPatterns inject() {
    SeedCatalog seeds = context.seedCatalog();
    if (seeds.isEmpty()) {
      logger.info("Seed patterns disabled, no pattern rows placed");
      return new InjectedPatterns(List.of(), List.of(), new PatternReport());
    }
    Placement placement = new Placement(context.streams().stream(StreamKind.PATTERNS), context.config().asOf());
    placement.brandLoyalty(seeds);
    placement.collaborative(seeds);
    placement.recommendationChains(seeds, context.config().chainCount());
    placement.productAffinity(seeds);
    placement.categoryExpansion(seeds);
    placement.categoryGap(seeds);
    placement.basketWindow(seeds);
    placement.churnRisk(seeds);
    placement.diversity(seeds);
    placement.segmentCoverage(seeds);
    placement.seedInteractions(seeds);

    logger.info("Placed {} pattern transactions and {} seed interactions",
        placement.transactions.size(), placement.interactions.size());
    for (PatternReport.Entry skipped : placement.report.skipped()) {
      logger.warn("Pattern {} skipped: {}", skipped.pattern().label(), skipped.detail());
    }
    return new InjectedPatterns(placement.transactions, placement.interactions, placement.report);
  }

  /// Build one recommendation chain: customers `c0..c3` and products `p0..p2` connected by
  /// the six purchases `(c0,p0) (c1,p0) (c1,p1) (c2,p1) (c2,p2) (c3,p2)`.
  /// @param customers exactly four distinct customers
  /// @param products exactly three distinct products
  /// @param rng the stream to draw amounts and times from
  /// @param asOf the reference instant
  /// @return the six chain transactions
  /// @throws IllegalArgumentException if the counts are wrong or entries repeat
  public static List<Transaction> chain(List<CustomerProfile> customers, List<Product> products,
                                        UniformRandomProvider rng, Instant asOf) {
    if (customers.size() != 4 || new HashSet<>(customers).size() != 4) {
      throw new IllegalArgumentException("A chain needs 4 distinct customers, got " + customers.size());
    }
    if (products.size() != 3 || new HashSet<>(products).size() != 3) {
      throw new IllegalArgumentException("A chain needs 3 distinct products, got " + products.size());
    }
    List<Transaction> edges = new ArrayList<>(6);
    for (int p = 0; p < 3; p++) {
      edges.add(purchase(rng, asOf, customers.get(p), products.get(p), null));
      edges.add(purchase(rng, asOf, customers.get(p + 1), products.get(p), null));
    }
    return edges;
  }

  static Transaction purchase(UniformRandomProvider rng, Instant asOf, CustomerProfile customer, Product product,
                              Instant at) {
    String id = DeterministicIds.next(rng);
    double factor = RandomGenerators.nextDoubleBetween(rng, 0.9d, 1.3d);
    int quantity = RandomGenerators.nextIntBetween(rng, 1, 2);
    Channel channel = RandomGenerators.pick(Channel.values(), rng);
    Instant timestamp = at != null ? at : RecencyTimestampSampler.daysBefore(rng, asOf, 1, 90);
    return new Transaction(id, customer.customerId(), product.productId(), Money.times(product.price(), factor),
        quantity, timestamp, channel, TransactionStatus.COMPLETED);
  }

  private static final class Placement {
    private final UniformRandomProvider rng;
    private final Instant asOf;
    private final List<Transaction> transactions = new ArrayList<>();
    private final List<Interaction> interactions = new ArrayList<>();
    private final PatternReport report = new PatternReport();

    private Placement(UniformRandomProvider rng, Instant asOf) {
      this.rng = rng;
      this.asOf = asOf;
    }

    private void buy(CustomerProfile customer, Product product) {
      transactions.add(purchase(rng, asOf, customer, product, null));
    }

    private void buy(CustomerProfile customer, Product product, Instant at) {
      transactions.add(purchase(rng, asOf, customer, product, at));
    }

    private <T> List<T> sample(List<T> from, int count) {
      List<T> copy = new ArrayList<>(from);
      RandomGenerators.shuffle(copy, rng);
      return copy.subList(0, Math.min(count, copy.size()));
    }

    void brandLoyalty(SeedCatalog seeds) {
      List<CustomerProfile> vips = seeds.customers(Segment.TOP_TIER, 0, 5);
      List<Product> apple = seeds.products(Category.ELECTRONICS, "Apple");
      if (vips.size() < 5 || apple.size() < 3) {
        report.skipped(Pattern.BRAND_LOYALTY, "needs 5 VIP seed customers and 3 Apple products");
        return;
      }
      int before = transactions.size();
      for (CustomerProfile vip : vips) {
        for (Product product : apple.subList(0, 3)) {
          buy(vip, product, RecencyTimestampSampler.daysBefore(rng, asOf, 10, 60));
        }
      }
      report.applied(Pattern.BRAND_LOYALTY, transactions.size() - before, "5 VIP customers x 3 Apple products");
    }

    void collaborative(SeedCatalog seeds) {
      List<CustomerProfile> vips = seeds.customers(Segment.TOP_TIER);
      List<Product> samsung = seeds.products(Category.ELECTRONICS, "Samsung");
      if (vips.size() < 4 || samsung.size() < 3) {
        report.skipped(Pattern.COLLABORATIVE, "needs 4 VIP seed customers and 3 Samsung products");
        return;
      }
      int before = transactions.size();
      buy(vips.get(0), samsung.get(0));
      buy(vips.get(1), samsung.get(0));
      buy(vips.get(1), samsung.get(1));
      buy(vips.get(2), samsung.get(1));
      buy(vips.get(3), samsung.get(1));
      buy(vips.get(3), samsung.get(2));
      report.applied(Pattern.COLLABORATIVE, transactions.size() - before, "shared Samsung purchases");
    }

    void recommendationChains(SeedCatalog seeds, int chainCount) {
      List<Product> products = seeds.allProducts();
      if (products.size() < 3) {
        report.skipped(Pattern.RECOMMENDATION_CHAIN, "needs 3 seed products");
        return;
      }
      int before = transactions.size();
      int built = 0;
      for (int k = 0; k < chainCount; k++) {
        List<CustomerProfile> vips = seeds.customers(Segment.TOP_TIER);
        List<CustomerProfile> premiums = seeds.customers(Segment.PREMIUM);
        List<CustomerProfile> regulars = seeds.customers(Segment.STANDARD);
        int partner = k + CHAIN_PARTNER_OFFSET;
        if (k >= CHAIN_LIMIT || k >= vips.size() || k >= premiums.size() || partner >= regulars.size()) {
          logger.warn("Recommendation chain {} skipped: not enough seed customers", k);
          continue;
        }
        List<CustomerProfile> members = List.of(vips.get(k), premiums.get(k), regulars.get(k), regulars.get(partner));
        List<Product> hops = List.of(
            products.get((k * 3) % products.size()),
            products.get((k * 3 + 1) % products.size()),
            products.get((k * 3 + 2) % products.size()));
        transactions.addAll(chain(members, hops, rng, asOf));
        built++;
      }
      if (built == 0 && chainCount > 0) {
        report.skipped(Pattern.RECOMMENDATION_CHAIN, "not enough seed customers for any chain");
        return;
      }
      report.applied(Pattern.RECOMMENDATION_CHAIN, transactions.size() - before,
          built + " of " + chainCount + " chains");
    }

    void productAffinity(SeedCatalog seeds) {
      List<CustomerProfile> premiums = seeds.customers(Segment.PREMIUM, 0, 5);
      List<Product> sony = seeds.products(Category.ELECTRONICS, "Sony");
      if (premiums.isEmpty() || sony.size() < 2) {
        report.skipped(Pattern.PRODUCT_AFFINITY, "needs Premium seed customers and 2 Sony products");
        return;
      }
      int before = transactions.size();
      for (CustomerProfile premium : premiums) {
        int count = Math.min(RandomGenerators.nextIntBetween(rng, 2, 3), sony.size());
        for (Product product : sony.subList(0, count)) {
          buy(premium, product);
        }
      }
      report.applied(Pattern.PRODUCT_AFFINITY, transactions.size() - before, "Sony bought together");
    }

    void categoryExpansion(SeedCatalog seeds) {
      List<CustomerProfile> vips = seeds.customers(Segment.TOP_TIER, 0, 3);
      List<Product> nike = seeds.products(Category.CLOTHING, "Nike");
      List<Product> ikea = seeds.products(Category.HOME, "IKEA");
      if (vips.isEmpty() || nike.isEmpty() || ikea.isEmpty()) {
        report.skipped(Pattern.CATEGORY_EXPANSION, "needs VIP seed customers, Nike Clothing and IKEA Home products");
        return;
      }
      int before = transactions.size();
      for (CustomerProfile vip : vips) {
        buy(vip, nike.get(0));
        buy(vip, ikea.get(0));
      }
      report.applied(Pattern.CATEGORY_EXPANSION, transactions.size() - before, "Electronics buyers in Clothing and Home");
    }

    void categoryGap(SeedCatalog seeds) {
      List<CustomerProfile> gapCustomers = new ArrayList<>();
      for (Segment segment : List.of(Segment.TOP_TIER, Segment.PREMIUM)) {
        for (CustomerProfile profile : seeds.customers(segment)) {
          if (!profile.exclusions().isEmpty()) {
            gapCustomers.add(profile);
          }
        }
      }
      if (gapCustomers.isEmpty()) {
        report.skipped(Pattern.CATEGORY_GAP, "no seed customer excludes a category");
        return;
      }
      int before = transactions.size();
      for (CustomerProfile profile : gapCustomers) {
        for (Category category : Category.values()) {
          if (profile.excludes(category)) {
            continue;
          }
          List<Product> pool = seedProducts(seeds, category);
          if (!pool.isEmpty()) {
            buy(profile, RandomGenerators.pick(pool, rng));
          }
        }
      }
      report.applied(Pattern.CATEGORY_GAP, transactions.size() - before,
          gapCustomers.size() + " customers buy everywhere except their excluded category");
    }

    void basketWindow(SeedCatalog seeds) {
      List<CustomerProfile> regulars = seeds.customers(Segment.STANDARD, 0, 5);
      List<Product> adidas = seeds.products(Category.CLOTHING, "Adidas");
      if (regulars.isEmpty() || adidas.size() < 2) {
        report.skipped(Pattern.BASKET_WINDOW, "needs Regular seed customers and 2 Adidas products");
        return;
      }
      int before = transactions.size();
      for (CustomerProfile regular : regulars) {
        Instant base = RecencyTimestampSampler.daysBefore(rng, asOf, 30, 60);
        List<Product> basket = sample(adidas, 3);
        for (int i = 0; i < basket.size(); i++) {
          buy(regular, basket.get(i), base.plus(2L * i, ChronoUnit.DAYS));
        }
      }
      report.applied(Pattern.BASKET_WINDOW, transactions.size() - before, "Adidas baskets 0, 2 and 4 days apart");
    }

    void churnRisk(SeedCatalog seeds) {
      List<CustomerProfile> churners = seeds.customers(Segment.TOP_TIER, CHURN_FROM, CHURN_TO);
      List<Product> pool = new ArrayList<>(seeds.products(Category.ELECTRONICS, "Apple"));
      pool.addAll(seeds.products(Category.ELECTRONICS, "Samsung"));
      if (churners.isEmpty() || pool.isEmpty()) {
        report.skipped(Pattern.CHURN_RISK, "needs VIP seed customers 5 to 7 and Apple or Samsung products");
        return;
      }
      int before = transactions.size();
      for (CustomerProfile churner : churners) {
        for (Product product : sample(pool, RandomGenerators.nextIntBetween(rng, 1, 2))) {
          buy(churner, product);
        }
      }
      report.applied(Pattern.CHURN_RISK, transactions.size() - before,
          churners.size() + " VIP customers with 1 or 2 purchases");
    }

    void diversity(SeedCatalog seeds) {
      List<CustomerProfile> premiums = seeds.customers(Segment.PREMIUM, 5, 8);
      List<List<Product>> pools = new ArrayList<>();
      for (List<Product> pool : List.of(
          seeds.products(Category.ELECTRONICS, "Apple"),
          seeds.products(Category.CLOTHING, "Nike"),
          seeds.products(Category.BOOKS, "Penguin"),
          seeds.products(Category.SPORTS, "Nike"),
          seeds.products(Category.BEAUTY, "Loreal"))) {
        if (!pool.isEmpty()) {
          pools.add(pool);
        }
      }
      if (premiums.isEmpty() || pools.size() < 4) {
        report.skipped(Pattern.DIVERSITY, "needs Premium seed customers 5 to 7 and products in 4 categories");
        return;
      }
      int before = transactions.size();
      for (CustomerProfile premium : premiums) {
        for (List<Product> pool : pools) {
          buy(premium, RandomGenerators.pick(pool, rng));
        }
      }
      report.applied(Pattern.DIVERSITY, transactions.size() - before, pools.size() + " categories per customer");
    }

    void segmentCoverage(SeedCatalog seeds) {
      List<Product> wayfair = seeds.products(Category.HOME, "Wayfair");
      List<Product> adidas = seeds.products(Category.CLOTHING, "Adidas");
      List<CustomerProfile> customers = new ArrayList<>(seeds.customers(Segment.BASIC, 0, 5));
      customers.addAll(seeds.customers(Segment.NEW, 0, 5));
      if (customers.isEmpty() || (wayfair.isEmpty() && adidas.isEmpty())) {
        report.skipped(Pattern.SEGMENT_COVERAGE, "needs Basic or New seed customers and Wayfair or Adidas products");
        return;
      }
      int before = transactions.size();
      for (CustomerProfile customer : customers) {
        if (!wayfair.isEmpty()) {
          buy(customer, RandomGenerators.pick(wayfair, rng));
        }
        if (!adidas.isEmpty()) {
          buy(customer, RandomGenerators.pick(adidas, rng));
        }
      }
      report.applied(Pattern.SEGMENT_COVERAGE, transactions.size() - before, "Basic and New customers purchase");
    }

    void seedInteractions(SeedCatalog seeds) {
      List<Product> products = seeds.allProducts();
      if (seeds.allCustomers().isEmpty() || products.isEmpty()) {
        report.skipped(Pattern.SEED_INTERACTIONS, "needs seed customers and products");
        return;
      }
      for (CustomerProfile customer : seeds.allCustomers()) {
        int count = RandomGenerators.nextIntBetween(rng, 5, 10);
        for (int i = 0; i < count; i++) {
          interactions.add(InteractionSynthesizer.draw(rng, customer.customerId(), products, asOf));
        }
      }
      report.applied(Pattern.SEED_INTERACTIONS, interactions.size(), "5 to 10 per seed customer");
    }

    private static List<Product> seedProducts(SeedCatalog seeds, Category category) {
      List<Product> pool = new ArrayList<>();
      for (Product product : seeds.allProducts()) {
        if (product.category() == category) {
          pool.add(product);
        }
      }
      return pool;
    }
  }
}
