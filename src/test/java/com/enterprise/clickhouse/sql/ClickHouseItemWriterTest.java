package com.enterprise.clickhouse.sql;

import com.enterprise.clickhouse.runner.InsertRequest;
import com.enterprise.clickhouse.spring.ClickHouseItemWriter;
import org.junit.jupiter.api.Test;
import org.springframework.batch.item.Chunk;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ClickHouseItemWriterTest {

    record Event(long id, String type) {}

    private final RecordingQueryRunner runner = new RecordingQueryRunner();
    private final ClickHouseItemWriter<Event> writer =
            new ClickHouseItemWriter<>(runner, "events", e -> Map.of("id", e.id(), "type", e.type()));

    @Test
    void writesChunkAsOneInsert() {
        writer.write(Chunk.of(new Event(1, "click"), new Event(2, "view")));

        assertThat(runner.inserts).hasSize(1);
        InsertRequest request = runner.inserts.get(0);
        assertThat(request.table()).isEqualTo("events");
        assertThat(request.format()).isEqualTo("JSONEachRow");
        assertThat(request.rows().stream().map(row -> row.get("type")).toList()).containsExactly("click", "view");
    }

    @Test
    void customFormat() {
        writer.setFormat("JSONStringsEachRow");
        writer.write(Chunk.of(new Event(1, "click")));

        assertThat(runner.inserts.get(0).format()).isEqualTo("JSONStringsEachRow");
    }

    @Test
    void emptyChunkIsSkipped() {
        writer.write(new Chunk<>());
        assertThat(runner.inserts).isEmpty();
    }
}
