package com.formdb.index.infrastructure.index.spatial;

import com.formdb.index.domain.model.BoundingBox;

interface Bounded {

    BoundingBox box();
}
