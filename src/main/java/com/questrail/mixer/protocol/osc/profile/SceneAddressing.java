package com.questrail.mixer.protocol.osc.profile;

import java.util.Objects;
import java.util.Optional;

/**
 * Scene (snapshot) addressing of one family.
 *
 * @param scene               human scene number to wire index
 * @param loadAddress         recall command, argument is the wire index
 * @param saveAddress         save command, argument is the wire index
 * @param loadBeforeSave      the family saves the <em>active</em> scene, so the
 *                            target is loaded first and named before saving
 * @param nameAddress         name address; contains {@code {}} for the scene
 *                            index when names are addressable per scene
 * @param activeIndexAddress  present when only the active scene's name is
 *                            readable; answers the active wire index
 */
public record SceneAddressing(
        IndexRule scene,
        String loadAddress,
        String saveAddress,
        boolean loadBeforeSave,
        String nameAddress,
        Optional<String> activeIndexAddress
) {
    public SceneAddressing {
        Objects.requireNonNull(scene, "scene");
        Objects.requireNonNull(loadAddress, "loadAddress");
        Objects.requireNonNull(saveAddress, "saveAddress");
        Objects.requireNonNull(nameAddress, "nameAddress");
        Objects.requireNonNull(activeIndexAddress, "activeIndexAddress");
    }

    public boolean perSceneNames() {
        return activeIndexAddress.isEmpty();
    }

    /**
     * Name address for {@code humanScene}. For active-only families this is
     * the same address for every scene.
     */
    public String nameAddressFor(int humanScene) {
        String formatted = scene.format(humanScene);
        return nameAddress.replace("{}", formatted);
    }
}
