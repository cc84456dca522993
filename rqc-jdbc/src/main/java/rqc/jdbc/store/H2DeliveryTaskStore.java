package rqc.jdbc.store;

import java.util.List;

/**
 * H2 task store. Primarily for testing.
 *
 * <p>Uses the portable insert-then-merge upsert from {@link AbstractJdbcDeliveryTaskStore}.
 */
public final class H2DeliveryTaskStore extends AbstractJdbcDeliveryTaskStore {

  public H2DeliveryTaskStore() {
    super();
  }

  public H2DeliveryTaskStore(String tableName) {
    super(tableName);
  }

  @Override
  public AbstractJdbcDeliveryTaskStore withTableName(String tableName) {
    return new H2DeliveryTaskStore(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
