package io.github.yok.masklink.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.masklink.config.PipelineConfig;
import io.github.yok.masklink.db.SqlDialect;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable description of one table copied by a run.
 */
@Value
@Builder
public class TableDescriptor {

    String name;
    int batchSize;
    // Static predicate; null when absent
    String filter;
    String watermarkColumn;
    // Empty when the table has no declared key
    @Builder.Default
    List<String> primaryKey = ImmutableList.of();
    boolean truncateOnFull;

    /**
     * Validates a configured table entry.
     *
     * @param entry configured table
     * @return descriptor
     * @throws IllegalArgumentException if the name, batch size, key or watermark column is invalid
     */
    public static TableDescriptor from(PipelineConfig.TableEntry entry) {
        Preconditions.checkArgument(StringUtils.isNotBlank(entry.getName()),
                "pipeline.tables[].name must not be blank");
        String name = entry.getName().trim();
        checkIdentifier(name, name);
        Preconditions.checkArgument(entry.getBatchSize() > 0, "[%s] batch-size must be > 0: %s",
                name, entry.getBatchSize());

        String watermarkColumn = StringUtils.trimToNull(entry.getWatermarkColumn());
        if (watermarkColumn != null) {
            checkIdentifier(name, watermarkColumn);
        }
        List<String> keys = entry.getPrimaryKey() == null ? ImmutableList.of()
                : entry.getPrimaryKey().stream().map(String::trim).filter(s -> !s.isEmpty())
                        .collect(ImmutableList.toImmutableList());
        keys.forEach(k -> checkIdentifier(name, k));

        return TableDescriptor.builder().name(name).batchSize(entry.getBatchSize())
                .filter(StringUtils.trimToNull(entry.getFilter()))
                .watermarkColumn(watermarkColumn).primaryKey(keys)
                .truncateOnFull(entry.isTruncateOnFull()).build();
    }

    /**
     * Returns whether loads into this table are upserts.
     *
     * @return {@code true} when a primary key is declared
     */
    public boolean isKeyed() {
        return !primaryKey.isEmpty();
    }

    private static void checkIdentifier(String table, String identifier) {
        Preconditions.checkArgument(SqlDialect.IDENTIFIER.matcher(identifier).matches(),
                "[%s] invalid identifier: %s", table, identifier);
    }
}
