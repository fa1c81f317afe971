package com.enterprise.clickhouse.sql;

import com.enterprise.clickhouse.spring.BatchQueryProvider;
import com.enterprise.clickhouse.spring.BatchReaderFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.database.JdbcCursorItemReader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.enterprise.clickhouse.sql.builder.QueryBuilders.select;
import static com.enterprise.clickhouse.sql.condition.Conditions.*;
import static org.assertj.core.api.Assertions.assertThat;

class BatchReaderFactoryTest {

    private static final String URL = "jdbc:h2:mem:reader;MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";

    private final BatchQueryProvider activeUsers = params -> select("name")
            .from("users")
            .where(where("status", eq(params.get("status"))))
            .orderBy("id");

    private BatchReaderFactory factory;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(URL);
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("DROP TABLE IF EXISTS `users`");
        jdbc.execute("CREATE TABLE `users` (`id` INT PRIMARY KEY, `name` VARCHAR(64), `status` VARCHAR(16))");
        jdbc.execute("INSERT INTO `users` VALUES (1, 'a', 'active'), (2, 'b', 'inactive'), (3, 'c', 'active')");
        factory = new BatchReaderFactory(dataSource);
        factory.setFetchSize(10);
    }

    @Test
    void resolvesQueryFromJobParameters() {
        assertThat(factory.resolveQuery(activeUsers, Map.of("status", "active")).sql())
                .isEqualTo("SELECT `name` FROM `users` WHERE `status` = 'active' ORDER BY `id` ASC");
    }

    @Test
    void cursorReaderReadsMatchingRows() throws Exception {
        JdbcCursorItemReader<String> reader = factory.cursorReader("activeUsers", activeUsers,
                (rs, i) -> rs.getString(1), Map.of("status", "active"));
        reader.afterPropertiesSet();

        List<String> names = new ArrayList<>();
        reader.open(new ExecutionContext());
        try {
            String name;
            while ((name = reader.read()) != null) {
                names.add(name);
            }
        } finally {
            reader.close();
        }

        assertThat(names).containsExactly("a", "c");
    }
}
