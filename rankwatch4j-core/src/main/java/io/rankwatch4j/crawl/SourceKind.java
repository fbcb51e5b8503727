package io.rankwatch4j.crawl;

import io.rankwatch4j.normalize.ShapeHint;

public enum SourceKind {
    HOT_LIST(ShapeHint.FLAT_LIST) {
        @Override
        public boolean isRanked() {
            return true;
        }
    },
    CATEGORY(ShapeHint.BLOCKS) {
        @Override
        public boolean isRanked() {
            return true;
        }
    },
    DETAIL(ShapeHint.SINGLE_OBJECT) {
        @Override
        public boolean isRanked() {
            return false;
        }
    };

    private final ShapeHint shape;

    SourceKind(ShapeHint shape) {
        this.shape = shape;
    }

    public ShapeHint shape() {
        return shape;
    }

    /**
     * Whether list order is a ranking worth a position snapshot.
     */
    public abstract boolean isRanked();
}
