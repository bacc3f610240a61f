package org.epistula.backup.service;

import org.epistula.backup.entity.Tenant;
import org.epistula.backup.repositories.SchemaCatalogRepository;
import org.epistula.backup.repositories.TenantRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TenantCatalogServiceTest {

    @Mock
    TenantRepository tenantRepository;

    @Mock
    SchemaCatalogRepository schemaCatalogRepository;

    @InjectMocks
    TenantCatalogService tenantCatalogService;

    private final Tenant production = Tenant.builder()
            .id(5).name("Northern University").code("NU").schemaName("uni_5").active(true).createdBy(1).build();

    @Test
    void registersNewInactiveWorkspaceRow() {
        when(tenantRepository.findBySchemaName("uni_5_temp")).thenReturn(Optional.empty());

        tenantCatalogService.registerTempWorkspace(production);

        ArgumentCaptor<Tenant> captor = ArgumentCaptor.forClass(Tenant.class);
        verify(tenantRepository).persist(captor.capture());
        Tenant row = captor.getValue();
        assertEquals("Northern University (temp)", row.getName());
        assertEquals("NU_TEMP", row.getCode());
        assertEquals("uni_5_temp", row.getSchemaName());
        assertEquals("Temporary restoration workspace for validation/export", row.getDescription());
        assertFalse(row.isActive());
        assertEquals(1, row.getCreatedBy());
    }

    @Test
    void truncatesWorkspaceCode() {
        production.setCode("C".repeat(48));
        when(tenantRepository.findBySchemaName("uni_5_temp")).thenReturn(Optional.empty());

        Tenant row = tenantCatalogService.registerTempWorkspace(production);

        assertEquals(50, row.getCode().length());
        assertEquals("C".repeat(48) + "_T", row.getCode());
    }

    @Test
    void refreshesExistingWorkspaceRow() {
        Tenant existing = Tenant.builder().id(42).name("stale").code("OLD").schemaName("uni_5_temp").active(true).build();
        when(tenantRepository.findBySchemaName("uni_5_temp")).thenReturn(Optional.of(existing));

        Tenant row = tenantCatalogService.registerTempWorkspace(production);

        assertSame(existing, row);
        assertEquals(42, row.getId());
        assertEquals("Northern University (temp)", row.getName());
        assertFalse(row.isActive());
        verify(tenantRepository, never()).persist(any(Tenant.class));
    }

    @Test
    void destroyDropsSchemaAndRow() {
        when(tenantRepository.delete("schemaName", "uni_5_temp")).thenReturn(1L);

        assertTrue(tenantCatalogService.destroyTempWorkspace(production));

        InOrder inOrder = inOrder(schemaCatalogRepository, tenantRepository);
        inOrder.verify(schemaCatalogRepository).dropSchemaIfExists("uni_5_temp");
        inOrder.verify(tenantRepository).delete("schemaName", "uni_5_temp");
    }

    @Test
    void finishPromotionDropsReplacedSchema() {
        when(tenantRepository.delete("schemaName", "uni_5_temp")).thenReturn(0L);

        assertFalse(tenantCatalogService.finishPromotion(production));

        verify(schemaCatalogRepository).dropSchemaIfExists("uni_5_old");
    }

    @Test
    void dropTenantRemovesSchemaAndRow() {
        tenantCatalogService.dropTenant(production);

        verify(schemaCatalogRepository).dropSchemaIfExists("uni_5");
        verify(tenantRepository).deleteById(5);
    }
}
