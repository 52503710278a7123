package com.misrhr.resample;

import com.misrhr.exception.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bytedeco.opencv.global.opencv_core.*;

class GridKindTest {

    @Test
    void parsesLabelsAndAliases() {
        assertThat(GridKind.fromName("RDQI")).isEqualTo(GridKind.RDQI);
        assertThat(GridKind.fromName(" mask ")).isEqualTo(GridKind.MASK);
        assertThat(GridKind.fromName("Scaled radiance with flag")).isEqualTo(GridKind.SCALED_RADIANCE_WITH_FLAG);
        assertThat(GridKind.fromName("radiance")).isEqualTo(GridKind.RADIANCE);
        assertThat(GridKind.fromName("BRF")).isEqualTo(GridKind.REFLECTANCE_FACTOR);
        assertThat(GridKind.fromName("ReflectanceFactor")).isEqualTo(GridKind.REFLECTANCE_FACTOR);
    }

    @Test
    void unknownNamesAreRejected() {
        GridFixtures.assertRejected(() -> GridKind.fromName("Reflectance"), ErrorKind.UNRECOGNIZED_KIND);
        GridFixtures.assertRejected(() -> GridKind.fromName(null), ErrorKind.UNRECOGNIZED_KIND);
    }

    @Test
    void depthCompatibility() {
        assertThat(GridKind.RDQI.acceptsDepth(CV_8U)).isTrue();
        assertThat(GridKind.MASK.acceptsDepth(CV_16U)).isFalse();
        assertThat(GridKind.SCALED_RADIANCE_WITH_FLAG.acceptsDepth(CV_16U)).isTrue();
        assertThat(GridKind.SCALED_RADIANCE_WITH_FLAG.acceptsDepth(CV_16S)).isFalse();
        assertThat(GridKind.RADIANCE.acceptsDepth(CV_32F)).isTrue();
        assertThat(GridKind.REFLECTANCE_FACTOR.acceptsDepth(CV_64F)).isTrue();
        assertThat(GridKind.REFLECTANCE_FACTOR.acceptsDepth(CV_8U)).isFalse();
    }
}
