package com.salesdw.service.quality;

import com.salesdw.model.Layer;

import java.util.Map;

/**
 * One declarative quality check: where it belongs, which SQL template measures it with which
 * identifiers, and how the numbers become a status and a message.
 */
public record QualityCheckDefinition(
    Layer layer,
    String category,
    String checkName,
    String tableName,
    String queryName,
    Map<String, String> placeholders,
    CheckClassifier classifier,
    CheckMessage message
) {}
