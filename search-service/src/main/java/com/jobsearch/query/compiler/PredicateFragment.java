package com.jobsearch.query.compiler;

import java.util.List;

import lombok.Value;

/**
 * Скомпилированное условие WHERE для одного поддерева.
 *
 * {@code nextOffset} - сколько параметров занято после этого поддерева,
 * следующий плейсхолдер будет {@code $(nextOffset + 1)}.
 */
@Value
public class PredicateFragment {

    String sql;
    List<String> parameters;
    int nextOffset;
}
