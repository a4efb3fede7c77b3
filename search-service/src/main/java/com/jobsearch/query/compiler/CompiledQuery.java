package com.jobsearch.query.compiler;

import java.util.List;
import java.util.Set;

import com.jobsearch.query.FieldType;

import lombok.Value;

/**
 * Результат компиляции: готовый SQL и параметры для него.
 *
 * {@code parameters.get(i)} привязывается к плейсхолдеру {@code $(i + 1)}.
 */
@Value
public class CompiledQuery {

    String statement;
    List<String> parameters;

    /**
     * Поля, для которых в запрос добавлены JOIN-ы.
     */
    Set<FieldType> requiredFields;
}
