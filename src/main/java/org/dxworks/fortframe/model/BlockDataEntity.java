package org.dxworks.fortframe.model;

public class BlockDataEntity extends ScopingUnit {
    public BlockDataEntity(String name) {
        super(EntityKind.BLOCK_DATA, name);
    }
}
