package io.intellixity.folio.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.bson.Document;

import java.util.*;

/**
 * Everything a paginator needs for one call: the caller's filter, sort, page window and projection.
 *
 * <p>Paginators deep-copy the filter and projection when a call starts, so a query may be reused
 * and modified afterwards without affecting a connection that is still being consumed.</p>
 */
@JsonSerialize(using = PageQueryJsonSerializer.class)
@JsonDeserialize(using = PageQueryJsonDeserializer.class)
public final class PageQuery {
  private Document filter = new Document();
  private Page page;
  private List<SortField> sort = new ArrayList<>();
  private Document projection;
  private String idPath;

  public PageQuery() {}

  public Document filter() { return filter; }
  public Page page() { return page; }
  public List<SortField> sort() { return sort; }
  public Document projection() { return projection; }
  /** Identifier path; {@code null} means the configured default. */
  public String idPath() { return idPath; }

  public PageQuery withFilter(Document filter) { this.filter = (filter == null) ? new Document() : filter; return this; }
  public PageQuery withPage(Page page) { this.page = page; return this; }
  public PageQuery withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }
  public PageQuery withSort(SortField sort) { return withSort(sort == null ? List.of() : List.of(sort)); }
  public PageQuery withProjection(Document projection) { this.projection = projection; return this; }
  public PageQuery withIdPath(String idPath) { this.idPath = idPath; return this; }

  /** First sort field, or {@code null} when unsorted. */
  public SortField primarySort() {
    return sort.isEmpty() ? null : sort.get(0);
  }

  public static PageQuery of(Document filter) {
    return new PageQuery().withFilter(filter);
  }
}
