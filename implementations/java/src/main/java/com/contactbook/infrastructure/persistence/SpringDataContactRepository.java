package com.contactbook.infrastructure.persistence;

import com.contactbook.domain.model.Contact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Spring Data JPA repository for {@link Contact}.
 *
 * <p>Only owner-qualified queries are declared here; callers must never use the
 * inherited unscoped finders for reads.
 */
@Repository
public interface SpringDataContactRepository extends JpaRepository<Contact, Long> {

    @Query("SELECT c FROM Contact c WHERE c.id = :id AND c.owner.id = :ownerId")
    Optional<Contact> findOwned(@Param("id") Long id, @Param("ownerId") Long ownerId);

    @Query("SELECT COUNT(c) > 0 FROM Contact c WHERE c.owner.id = :ownerId AND (c.email = :email OR c.phone = :phone)")
    boolean existsOwnedByEmailOrPhone(@Param("ownerId") Long ownerId,
                                      @Param("email") String email,
                                      @Param("phone") String phone);
}
