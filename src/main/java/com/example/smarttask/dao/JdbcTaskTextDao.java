package com.example.smarttask.dao;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcTaskTextDao implements TaskTextDao {

    private static final String TITLES_SQL = """
            select title
            from tasks
            where title is not null
            order by id
            """;

    private static final String DESCRIPTIONS_SQL = """
            select description
            from tasks
            where description is not null
            order by id
            """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<String> listTitles() {
        List<String> titles = jdbcTemplate.queryForList(TITLES_SQL, String.class);
        log.debug("Loaded {} task titles", titles.size());
        return titles;
    }

    @Override
    public List<String> listDescriptions() {
        List<String> descriptions = jdbcTemplate.queryForList(DESCRIPTIONS_SQL, String.class);
        log.debug("Loaded {} task descriptions", descriptions.size());
        return descriptions;
    }
}
