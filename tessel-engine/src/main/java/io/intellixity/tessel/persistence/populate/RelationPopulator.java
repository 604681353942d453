package io.intellixity.tessel.persistence.populate;

import io.intellixity.tessel.persistence.exec.Futures;
import io.intellixity.tessel.persistence.mapping.ResultRow;
import io.intellixity.tessel.persistence.metadata.*;
import io.intellixity.tessel.persistence.query.Criteria;
import io.intellixity.tessel.persistence.query.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves relations onto already materialized rows.
 * <p>
 * A single row is populated with per-row lookups ({@code {pk: fk}}, {@code {via: pk}}); several rows are
 * populated in batch with one lookup per relation ({@code {pk: ids}}, {@code {via: ids}}) and the results are
 * distributed back by key. Sibling requests run concurrently and a request's nested populates finish before the
 * request itself counts as done. Rows are only modified after every request has succeeded.
 * <p>
 * Ids are matched by their string form, so an int4 foreign key still finds a bigint primary key read back as
 * text or coerced to a Long.
 */
public final class RelationPopulator {
  private static final Logger log = LoggerFactory.getLogger(RelationPopulator.class);

  private final ModelRegistry registry;
  private final RowFinder finder;

  public RelationPopulator(ModelRegistry registry, RowFinder finder) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.finder = Objects.requireNonNull(finder, "finder");
  }

  private record Assignment(String property, List<Object> values) {}

  public CompletableFuture<Void> populate(ModelMetadata model, List<ResultRow> rows, List<PopulateRequest> requests) {
    if (rows == null || rows.isEmpty() || requests == null || requests.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    List<CompletableFuture<Assignment>> branches = new ArrayList<>(requests.size());
    try {
      for (PopulateRequest request : requests) branches.add(branch(model, rows, request));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    return Futures.allOrFirstFailure(branches).thenAccept(assignments -> {
      for (Assignment a : assignments) {
        for (int i = 0; i < rows.size(); i++) rows.get(i).put(a.property(), a.values().get(i));
      }
    });
  }

  private CompletableFuture<Assignment> branch(ModelMetadata model, List<ResultRow> rows, PopulateRequest request) {
    String property = request.propertyName();
    ColumnMetadata column = model.column(property);
    if (!(column instanceof ModelColumn) && !(column instanceof CollectionColumn)) {
      throw new ConfigurationException("Unable to find " + property + " on " + model.name() + " model for populating.");
    }
    if (log.isTraceEnabled()) {
      log.trace("tessel.populate model={} property={} rows={} nested={}", model.name(), property, rows.size(), request.nested().size());
    }

    CompletableFuture<List<Object>> values;
    if (column instanceof ModelColumn mc) {
      values = belongsTo(rows, mc, request);
    } else {
      CollectionColumn cc = (CollectionColumn) column;
      values = cc.manyToMany() ? manyToMany(model, rows, cc, request) : hasMany(model, rows, cc, request);
    }
    return values.thenApply(v -> new Assignment(property, v));
  }

  private CompletableFuture<List<Object>> belongsTo(List<ResultRow> rows, ModelColumn column, PopulateRequest request) {
    ModelMetadata target = registry.target(column);
    String pk = target.primaryKey().propertyName();

    List<Object> fks = new ArrayList<>(rows.size());
    Map<String, Object> distinct = new LinkedHashMap<>();
    for (ResultRow row : rows) {
      Object fk = relationId(row.get(column.propertyName()), pk);
      fks.add(fk);
      if (fk != null) distinct.putIfAbsent(key(fk), fk);
    }
    if (distinct.isEmpty()) return CompletableFuture.completedFuture(filled(rows.size(), null));

    boolean single = rows.size() == 1;
    Object lookup = single ? fks.get(0) : new ArrayList<>(distinct.values());
    Criteria criteria = new Criteria(request.select(), merge(pk, lookup, request), request.sorts(), null, single ? 1 : null);

    return fetch(target, criteria, request).thenApply(related -> {
      Map<String, ResultRow> byId = index(related, pk);
      List<Object> out = new ArrayList<>(rows.size());
      for (Object fk : fks) out.add(fk == null ? null : byId.get(key(fk)));
      return out;
    });
  }

  private CompletableFuture<List<Object>> hasMany(ModelMetadata model, List<ResultRow> rows, CollectionColumn column,
                                                  PopulateRequest request) {
    ModelMetadata target = registry.target(column);
    String via = column.via();
    if (rows.size() > 1 && request.select() != null && !request.select().contains(via)) {
      throw new ValidationException("Unable to populate \"" + request.propertyName() + "\" on " + model.name()
          + ". \"" + via + "\" is not included in select array.");
    }

    List<Object> ids = ownerIds(model, rows, column);
    boolean single = rows.size() == 1;
    Criteria criteria = new Criteria(request.select(), merge(via, single ? ids.get(0) : ids, request),
        request.sorts(), request.skip(), request.limit());

    String ownerPk = model.primaryKey().propertyName();
    return fetch(target, criteria, request).thenApply(related -> {
      if (single) return List.<Object>of(related);
      Map<String, List<ResultRow>> grouped = new HashMap<>();
      for (ResultRow r : related) {
        Object owner = relationId(r.get(via), ownerPk);
        if (owner != null) grouped.computeIfAbsent(key(owner), k -> new ArrayList<>()).add(r);
      }
      List<Object> out = new ArrayList<>(rows.size());
      for (ResultRow row : rows) out.add(grouped.getOrDefault(key(row.get(ownerPk)), new ArrayList<>()));
      return out;
    });
  }

  private CompletableFuture<List<Object>> manyToMany(ModelMetadata model, List<ResultRow> rows, CollectionColumn column,
                                                     PopulateRequest request) {
    ModelMetadata target = registry.target(column);
    ModelMetadata through = registry.through(column);
    CollectionColumn counterpart = registry.counterpart(column);
    String ownerPk = model.primaryKey().propertyName();
    String targetPk = target.primaryKey().propertyName();

    List<Object> ids = ownerIds(model, rows, column);
    boolean single = rows.size() == 1;
    List<String> throughSelect = single ? List.of(counterpart.via()) : List.of(column.via(), counterpart.via());
    Map<String, Object> throughWhere = new LinkedHashMap<>();
    throughWhere.put(column.via(), single ? ids.get(0) : ids);

    return finder.find(through, new Criteria(throughSelect, throughWhere, null, null, null)).thenCompose(joins -> {
      Map<String, List<Object>> targetIdsByOwner = new HashMap<>();
      Map<String, Object> distinct = new LinkedHashMap<>();
      String onlyOwner = single ? key(ids.get(0)) : null;
      for (ResultRow join : joins) {
        Object targetId = relationId(join.get(counterpart.via()), targetPk);
        if (targetId == null) continue;
        String owner = single ? onlyOwner : key(relationId(join.get(column.via()), ownerPk));
        targetIdsByOwner.computeIfAbsent(owner, k -> new ArrayList<>()).add(targetId);
        distinct.putIfAbsent(key(targetId), targetId);
      }
      if (distinct.isEmpty()) return CompletableFuture.completedFuture(emptyLists(rows.size()));

      Criteria criteria = new Criteria(request.select(), merge(targetPk, new ArrayList<>(distinct.values()), request),
          request.sorts(), request.skip(), request.limit());
      return fetch(target, criteria, request).thenApply(related -> {
        if (single) return List.<Object>of(related);
        Map<String, ResultRow> byId = index(related, targetPk);
        List<Object> out = new ArrayList<>(rows.size());
        for (ResultRow row : rows) {
          List<ResultRow> items = new ArrayList<>();
          for (Object id : targetIdsByOwner.getOrDefault(key(row.get(ownerPk)), List.of())) {
            ResultRow item = byId.get(key(id));
            if (item != null) items.add(item);
          }
          out.add(items);
        }
        return out;
      });
    });
  }

  /** Finds related rows, then applies the request's nested populates to them. */
  private CompletableFuture<List<ResultRow>> fetch(ModelMetadata target, Criteria criteria, PopulateRequest request) {
    return finder.find(target, criteria)
        .thenCompose(related -> populate(target, related, request.nested()).thenApply(v -> related));
  }

  private static List<Object> ownerIds(ModelMetadata model, List<ResultRow> rows, CollectionColumn column) {
    String pk = model.primaryKey().propertyName();
    Map<String, Object> distinct = new LinkedHashMap<>();
    for (ResultRow row : rows) {
      Object id = row.get(pk);
      if (id == null) {
        throw new ValidationException("Primary key (" + pk + ") has no value for populating \"" + column.propertyName()
            + "\" on " + model.name() + ". Include it in the select.");
      }
      distinct.putIfAbsent(key(id), id);
    }
    return new ArrayList<>(distinct.values());
  }

  /** Relation key with the caller's where merged on top; caller keys win. */
  private static Map<String, Object> merge(String property, Object value, PopulateRequest request) {
    Map<String, Object> where = new LinkedHashMap<>();
    where.put(property, value);
    where.putAll(request.where());
    return where;
  }

  private static Map<String, ResultRow> index(List<ResultRow> rows, String pk) {
    Map<String, ResultRow> byId = new HashMap<>();
    for (ResultRow r : rows) {
      Object id = r.get(pk);
      if (id != null) byId.putIfAbsent(key(id), r);
    }
    return byId;
  }

  /** A foreign key value, or the primary key of an already hydrated relation. */
  private static Object relationId(Object value, String pk) {
    if (value instanceof Map<?, ?> hydrated) return hydrated.get(pk);
    return value;
  }

  private static String key(Object id) {
    return String.valueOf(id);
  }

  private static List<Object> filled(int n, Object value) {
    return new ArrayList<>(Collections.nCopies(n, value));
  }

  private static List<Object> emptyLists(int n) {
    List<Object> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) out.add(new ArrayList<ResultRow>());
    return out;
  }
}
