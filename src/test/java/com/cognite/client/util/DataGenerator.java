package com.cognite.client.util;

import com.cognite.client.dto.RawRow;
import org.apache.commons.lang3.RandomStringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

public class DataGenerator {
    public static final String sourceKey = "source";
    public static final String sourceValue = "unitTest";

    public static List<String> generateListString(int noObjects) {
        List<String> objects = new ArrayList<>(noObjects);
        for (int i = 0; i < noObjects; i++) {
            objects.add(RandomStringUtils.randomAlphanumeric(10));
        }
        return objects;
    }

    public static List<RawRow> generateRawRows(String dbName, String tableName, int noObjects) {
        List<RawRow> objects = new ArrayList<>(noObjects);
        for (int i = 0; i < noObjects; i++) {
            Map<String, Object> columns = new LinkedHashMap<>();
            columns.put("string", RandomStringUtils.randomAlphanumeric(10));
            columns.put("numeric", ThreadLocalRandom.current().nextLong(10000));
            columns.put("bool", ThreadLocalRandom.current().nextBoolean());
            columns.put("null_value", null);
            columns.put(sourceKey, sourceValue);
            objects.add(RawRow.of(dbName, tableName, RandomStringUtils.randomAlphanumeric(10), columns));
        }
        return objects;
    }
}
