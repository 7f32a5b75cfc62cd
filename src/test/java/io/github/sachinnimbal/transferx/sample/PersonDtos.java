package io.github.sachinnimbal.transferx.sample;

import io.github.sachinnimbal.transferx.core.enums.RenameStrategy;
import io.github.sachinnimbal.transferx.dto.BeanDto;
import io.github.sachinnimbal.transferx.dto.RecordDto;
import io.github.sachinnimbal.transferx.dto.config.DtoConfig;

final class PersonDtos {

    private PersonDtos() {
    }

    public static class PersonReadDto extends BeanDto<Person> {
        public PersonReadDto() {
            super(DtoConfig.builder().exclude("email").exclude("address.street").build());
        }
    }

    public static class PersonFullDto extends BeanDto<Person> {
    }

    public static class PersonWriteDto extends BeanDto<Person> {
        public PersonWriteDto() {
            super(DtoConfig.builder().exclude("id").build());
        }
    }

    public static class PersonPatchDto extends BeanDto<Person> {
        public PersonPatchDto() {
            super(DtoConfig.builder().exclude("id").partial(true).build());
        }
    }

    public static class ProfileDto extends RecordDto<Profile> {
        public ProfileDto() {
            super(DtoConfig.builder().renameStrategy(RenameStrategy.CAMEL).build());
        }
    }
}
