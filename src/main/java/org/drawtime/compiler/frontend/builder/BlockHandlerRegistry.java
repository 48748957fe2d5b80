package org.drawtime.compiler.frontend.builder;

import org.drawtime.compiler.frontend.lexer.BlockKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry mapping block kinds to the handlers that apply them.
 */
public class BlockHandlerRegistry {
    private final Map<BlockKind, IBlockHandler> handlers = new EnumMap<>(BlockKind.class);

    /**
     * Registers a handler, replacing any earlier one for the same kind.
     * @param kind The block kind.
     * @param handler The handler for blocks of that kind.
     */
    public void register(BlockKind kind, IBlockHandler handler) {
        handlers.put(kind, handler);
    }

    /**
     * @param kind The block kind.
     * @return The handler for the kind, or empty if none is registered.
     */
    public Optional<IBlockHandler> get(BlockKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    /**
     * @return A registry with handlers for all built-in block kinds.
     */
    public static BlockHandlerRegistry initialize() {
        BlockHandlerRegistry registry = new BlockHandlerRegistry();
        registry.register(BlockKind.TIME, new TimeBlockHandler());
        registry.register(BlockKind.STYLE, new StyleBlockHandler());
        ValueSignalBlockHandler valueSignalHandler = new ValueSignalBlockHandler();
        registry.register(BlockKind.LINE, valueSignalHandler);
        registry.register(BlockKind.BUS, valueSignalHandler);
        registry.register(BlockKind.CLOCK, new ClockBlockHandler());
        return registry;
    }
}
