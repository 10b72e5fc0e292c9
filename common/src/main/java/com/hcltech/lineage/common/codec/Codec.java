package com.hcltech.lineage.common.codec;

import com.hcltech.lineage.common.errorsor.ErrorsOr;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);
}
