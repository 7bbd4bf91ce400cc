package com.terradrift.core.source.terraform;

import com.terradrift.core.model.AttributePath;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TerraformLookupTest {

    @Test
    void defaults_matchEc2InstancesByNameTag() {
        TerraformLookup lookup = TerraformLookup.defaults();

        assertThat(lookup.resourceType()).isEqualTo("aws_instance");
        assertThat(lookup.stateIdentifierField()).isEqualTo("id");
        assertThat(lookup.definitionMatchAttribute()).isEqualTo(AttributePath.parse("tags.Name"));
    }

    @Test
    void of_blankValues_fallBackToDefaults() {
        TerraformLookup lookup = TerraformLookup.of(" ", null, "");

        assertThat(lookup).isEqualTo(TerraformLookup.defaults());
    }

    @Test
    void of_givenValues_areUsed() {
        TerraformLookup lookup = TerraformLookup.of("aws_db_instance", "identifier", "tags.Service");

        assertThat(lookup.resourceType()).isEqualTo("aws_db_instance");
        assertThat(lookup.stateIdentifierField()).isEqualTo("identifier");
        assertThat(lookup.definitionMatchAttribute().segments()).containsExactly("tags", "Service");
    }
}
