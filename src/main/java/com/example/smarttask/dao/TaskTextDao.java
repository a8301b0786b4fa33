package com.example.smarttask.dao;

import java.util.List;

/**
 * Read-only view of the free text stored on tasks. Both listings follow the same task ordering so
 * that callers scanning titles and then descriptions see one consistent sequence.
 */
public interface TaskTextDao {

    /** Non-null task titles in store order. */
    List<String> listTitles();

    /** Non-null task descriptions in store order. */
    List<String> listDescriptions();
}
