package io.fleetstate.cleanup;

import io.fleetstate.model.DestroyModelParams;
import io.fleetstate.model.Life;
import io.fleetstate.state.StateException;
import io.fleetstate.support.InMemoryModelState;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ModelCleanupsTest {

    @Test
    void relationSettingsRemovesEveryKeyUnderThePrefix() {
        InMemoryModelState state = new InMemoryModelState("model-settings");
        state.addRelationSettings("r#7#mysql/0");
        state.addRelationSettings("r#7#wordpress/0");
        state.addRelationSettings("r#8#mysql/0");

        new ModelCleanups(state).relationSettings("r#7#");

        Assertions.assertFalse(state.hasRelationSettings("r#7#mysql/0"));
        Assertions.assertFalse(state.hasRelationSettings("r#7#wordpress/0"));
        Assertions.assertTrue(state.hasRelationSettings("r#8#mysql/0"));
    }

    @Test
    void unusedCharmIsRemoved() {
        InMemoryModelState state = new InMemoryModelState("model-charm");
        state.addCharm("cs:~acme/wordpress-3", false);

        Diagnostics diagnostics = new ModelCleanups(state).charm("cs:~acme/wordpress-3");

        Assertions.assertTrue(diagnostics.isEmpty());
        Assertions.assertTrue(state.findCharm("cs:~acme/wordpress-3").isEmpty());
    }

    @Test
    void charmInUseOrMissingIsNotAnError() {
        InMemoryModelState state = new InMemoryModelState("model-charm-in-use");
        state.addCharm("local:mysql-12", true);
        ModelCleanups cleanups = new ModelCleanups(state);

        Assertions.assertTrue(cleanups.charm("local:mysql-12").isEmpty());
        Assertions.assertTrue(state.findCharm("local:mysql-12").isPresent());
        Assertions.assertTrue(cleanups.charm("cs:postgresql-1").isEmpty());
    }

    @Test
    void invalidCharmUrlFailsTheTask() {
        ModelCleanups cleanups = new ModelCleanups(new InMemoryModelState("model-charm-invalid"));

        StateException error = Assertions.assertThrows(StateException.class, () -> cleanups.charm("http://wordpress"));
        Assertions.assertTrue(error.getMessage().startsWith("invalid charm URL http://wordpress"));
    }

    @Test
    void applicationsForDyingModelDestroysRemoteApplicationsFirst() {
        InMemoryModelState state = new InMemoryModelState("model-apps");
        InMemoryModelState.FakeApplication mysql = state.addApplication("mysql");
        InMemoryModelState.FakeApplication gone = state.addApplication("legacy");
        gone.life = Life.DEAD;
        state.addRemoteApplication("remote-db");

        new ModelCleanups(state).applicationsForDyingModel();

        Assertions.assertEquals(List.of("destroyRemoteApplication remote-db", "destroyApplication mysql"), state.events());
        Assertions.assertTrue(mysql.offersRemoved);
        Assertions.assertEquals(Life.DEAD, gone.life);
    }

    @Test
    void modelsForDyingControllerForwardsParamsAndSkipsVanishedModels() {
        InMemoryModelState state = new InMemoryModelState("controller-model");
        InMemoryModelState.FakeModel first = state.addModel("model-a");
        InMemoryModelState.FakeModel second = state.addModel("model-b");
        state.addVanishedModel("model-c");
        DestroyModelParams params = new DestroyModelParams(false, true, 10_000L);

        Diagnostics diagnostics = new ModelCleanups(state).modelsForDyingController(params);

        Assertions.assertTrue(diagnostics.isEmpty());
        Assertions.assertEquals(params, first.destroyedWith);
        Assertions.assertEquals(params, second.destroyedWith);
        Assertions.assertEquals(Life.DYING, second.life);
    }

    @Test
    void resourceBlobToleratesPlaceholdersAndRepeats() {
        InMemoryModelState state = new InMemoryModelState("model-blobs");
        state.addBlob("resources/mysql/config");
        ModelCleanups cleanups = new ModelCleanups(state);

        Assertions.assertTrue(cleanups.resourceBlob("").isEmpty());
        Assertions.assertTrue(cleanups.resourceBlob("resources/mysql/config").isEmpty());
        Assertions.assertFalse(state.hasBlob("resources/mysql/config"));
        Assertions.assertTrue(cleanups.resourceBlob("resources/mysql/config").isEmpty());
        Assertions.assertEquals(List.of("removeResourceBlob resources/mysql/config"), state.events());
    }
}
