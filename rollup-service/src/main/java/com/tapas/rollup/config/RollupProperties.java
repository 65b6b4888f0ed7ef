package com.tapas.rollup.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties("rollup")
public class RollupProperties {

    /**
     * Kafka topic carrying child record change events.
     */
    private String topic = "child-record-changes";

    /**
     * Whether parent records computed from change events are written back.
     */
    private boolean persistResults = true;

    private Schema schema = new Schema();

    @Getter
    @Setter
    public static class Schema {
        private Map<String, Entity> entities = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Entity {
        private String table;
        private String idColumn = "id";
        /**
         * Field name to column name. A blank column means the field name is the column.
         */
        private Map<String, String> fields = new LinkedHashMap<>();
    }
}
