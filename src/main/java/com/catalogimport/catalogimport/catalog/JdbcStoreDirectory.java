package com.catalogimport.catalogimport.catalog;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcStoreDirectory implements StoreDirectory {

    private final JdbcTemplate jdbcTemplate;

    public JdbcStoreDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Long> findStoreId(String storeCode) {
        List<Long> ids = jdbcTemplate.queryForList(
                "SELECT store_id FROM catalog_store WHERE LOWER(code) = LOWER(?)",
                Long.class,
                storeCode.trim()
        );
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }
}
