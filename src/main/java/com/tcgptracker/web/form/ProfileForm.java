package com.tcgptracker.web.form;

import com.tcgptracker.users.UserProfile;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ProfileForm {

    @Size(max = 10, message = "Friend codes have at most 10 characters")
    private String friendCode;

    private boolean publicProfile = true;

    public static ProfileForm from(UserProfile profile) {
        ProfileForm form = new ProfileForm();
        form.setFriendCode(profile.getFriendCode());
        form.setPublicProfile(profile.isPublicProfile());
        return form;
    }
}
