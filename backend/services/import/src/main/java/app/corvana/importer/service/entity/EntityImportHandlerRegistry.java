package app.corvana.importer.service.entity;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class EntityImportHandlerRegistry {

    private final Map<EntityType, EntityImportHandler<?>> handlers;

    public EntityImportHandlerRegistry(List<EntityImportHandler<?>> list) {
        Map<EntityType, EntityImportHandler<?>> map = new EnumMap<>(EntityType.class);
        for (var h : list) map.put(h.type(), h);
        this.handlers = map;
    }

    public EntityImportHandler<?> require(EntityType type) {
        var h = handlers.get(type);
        if (h == null) throw new IllegalArgumentException("Unsupported entity type: " + type);
        return h;
    }
}
