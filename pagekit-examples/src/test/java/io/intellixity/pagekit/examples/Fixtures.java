package io.intellixity.pagekit.examples;

import io.intellixity.pagekit.PagingEngine;
import io.intellixity.pagekit.examples.config.PagekitProperties;
import io.intellixity.pagekit.examples.rpc.UserRpcService;
import io.intellixity.pagekit.examples.service.UserDirectory;
import io.intellixity.pagekit.examples.service.UserService;
import io.intellixity.pagekit.query.QueryStringTranslator;
import io.intellixity.pagekit.row.Row;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Wires the example beans by hand, the way the application config does. */
public final class Fixtures {
  public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
  public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  public final PagekitProperties props;
  public final UserDirectory directory;
  public final PagingEngine engine;
  public final UserService users;
  public final UserRpcService rpc;

  public Fixtures() {
    this(new PagekitProperties());
  }

  public Fixtures(PagekitProperties props) {
    this.props = props;
    this.directory = new UserDirectory(props.getSeedUsers(), CLOCK);
    this.engine = new PagingEngine(props.toPagingConfig(UserDirectory.SCHEMA), UserDirectory.SEARCH_FIELDS);
    this.users = new UserService(directory, engine, new QueryStringTranslator(UserDirectory.SCHEMA));
    this.rpc = new UserRpcService(directory, engine);
  }

  public static List<String> ids(Collection<Row> rows) {
    List<String> out = new ArrayList<>(rows.size());
    for (Row r : rows) out.add(r.id());
    return out;
  }
}
